package scadflow.runtime.ast;

import com.scadflow.compiler.ast.Argument;
import com.scadflow.compiler.ast.AstNode;
import com.scadflow.compiler.ast.Binding;
import com.scadflow.compiler.ast.NodeCategory;
import com.scadflow.compiler.ast.ParameterDecl;
import com.scadflow.compiler.ast.expr.Expression;
import com.scadflow.compiler.ast.expr.LiteralExpr;
import com.scadflow.compiler.ast.stmt.AssignmentNode;
import com.scadflow.compiler.ast.stmt.ForNode;
import com.scadflow.compiler.ast.stmt.IfNode;
import com.scadflow.compiler.ast.stmt.LetNode;
import com.scadflow.compiler.ast.stmt.ModuleDefinitionNode;
import scadflow.runtime.Result;
import scadflow.runtime.builtin.BuiltinSignatures;
import scadflow.runtime.builtin.Signature;
import scadflow.runtime.perf.MemoryUsage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 节点分类器
 *
 * <p>校验单个节点、计算其语义类别并提取参数。子节点递归处理；
 * 宽松模式下分类失败的子节点被跳过并记录在元数据中，严格模式下整体失败。</p>
 */
public final class NodeClassifier {

    private static final Logger LOG = Logger.getLogger(NodeClassifier.class.getName());

    private final boolean lenientChildProcessing;

    public NodeClassifier(boolean lenientChildProcessing) {
        this.lenientChildProcessing = lenientChildProcessing;
    }

    public NodeClassifier() {
        this(true);
    }

    public boolean isLenientChildProcessing() {
        return lenientChildProcessing;
    }

    /**
     * 类型名非空且带有源码位置
     */
    public boolean validate(AstNode node) {
        if (node == null) return false;
        String type = node.getType();
        return type != null && !type.isEmpty() && node.getLocation() != null;
    }

    public NodeCategory classify(AstNode node) {
        return NodeCategory.of(node != null ? node.getType() : null);
    }

    /**
     * 提取节点声明的参数
     *
     * <p>调用节点：命名参数按名称，位置参数按内置签名的形参名，无签名时按下标；
     * 模块定义：形参名到默认值（无默认值为 undef）；
     * 控制流：条件表达式或绑定变量。</p>
     */
    public Map<String, Expression> extractParameters(AstNode node) {
        Map<String, Expression> params = new LinkedHashMap<>();
        if (node instanceof ModuleDefinitionNode) {
            for (ParameterDecl p : ((ModuleDefinitionNode) node).getParameters()) {
                params.put(p.getName(), p.hasDefault() ? p.getDefaultValue() : LiteralExpr.undef(node.getLocation()));
            }
            return params;
        }
        if (node instanceof IfNode) {
            params.put("condition", ((IfNode) node).getCondition());
            return params;
        }
        if (node instanceof ForNode) {
            putBindings(params, ((ForNode) node).getBindings());
            return params;
        }
        if (node instanceof LetNode) {
            putBindings(params, ((LetNode) node).getBindings());
            return params;
        }
        if (node instanceof AssignmentNode) {
            AssignmentNode a = (AssignmentNode) node;
            params.put(a.getName(), a.getValue());
            return params;
        }

        Signature signature = BuiltinSignatures.lookup(node.getType());
        int position = 0;
        for (Argument arg : node.getArguments()) {
            if (arg.isNamed()) {
                params.put(arg.getName(), arg.getValue());
            } else {
                String name = signature != null ? signature.positionalName(position) : null;
                params.put(name != null ? name : String.valueOf(position), arg.getValue());
                position++;
            }
        }
        return params;
    }

    private void putBindings(Map<String, Expression> params, List<Binding> bindings) {
        for (Binding b : bindings) {
            params.put(b.getName(), b.getValue());
        }
    }

    /**
     * 校验、分类、提取参数并递归处理子节点
     */
    public Result<ProcessedNode, ProcessingException> processNode(AstNode node) {
        try {
            return Result.ok(process(node));
        } catch (ProcessingException e) {
            return Result.err(e);
        } catch (RuntimeException e) {
            String type = node != null ? node.getType() : null;
            return Result.err(new ProcessingException("Failed to process node: " + e.getMessage(), type, e));
        }
    }

    ProcessedNode process(AstNode node) {
        long start = System.nanoTime();
        long memoryBefore = MemoryUsage.currentUsed();

        if (!validate(node)) {
            String type = node != null ? node.getType() : null;
            throw new ProcessingException("Invalid AST node: " + type, type);
        }
        NodeCategory category = classify(node);
        if (category == NodeCategory.UNKNOWN) {
            throw new ProcessingException("Unknown node type: " + node.getType(), node.getType());
        }

        Map<String, Expression> parameters = extractParameters(node);

        List<ProcessedNode> children = new ArrayList<>();
        List<SkippedChild> skipped = new ArrayList<>();
        for (AstNode child : node.getChildren()) {
            try {
                children.add(process(child));
            } catch (ProcessingException e) {
                if (!lenientChildProcessing) {
                    throw new ProcessingException("Child node processing failed: " + e.getMessage(),
                            node.getType(), e);
                }
                LOG.log(Level.WARNING, "Skipping malformed child of {0}: {1}",
                        new Object[]{node.getType(), e.getMessage()});
                skipped.add(new SkippedChild(child, e.getMessage()));
            }
        }

        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
        long memoryDelta = MemoryUsage.currentUsed() - memoryBefore;
        NodeProcessingMetadata metadata = new NodeProcessingMetadata(elapsedMs, memoryDelta,
                skipped.isEmpty() ? Collections.<SkippedChild>emptyList() : skipped);
        return new ProcessedNode(node, category, parameters, children, metadata);
    }
}
