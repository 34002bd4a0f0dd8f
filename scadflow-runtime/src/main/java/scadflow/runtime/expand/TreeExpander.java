package scadflow.runtime.expand;

import com.scadflow.compiler.ast.Argument;
import com.scadflow.compiler.ast.Binding;
import com.scadflow.compiler.ast.StatementModifier;
import com.scadflow.compiler.ast.stmt.AssignmentNode;
import com.scadflow.compiler.ast.stmt.CallNode;
import com.scadflow.compiler.ast.stmt.ForNode;
import com.scadflow.compiler.ast.stmt.IfNode;
import com.scadflow.compiler.ast.stmt.LetNode;
import com.scadflow.compiler.ast.stmt.ModuleDefinitionNode;
import com.scadflow.compiler.ast.stmt.ModuleInstantiationNode;
import com.scadflow.compiler.ast.stmt.Statement;
import scadflow.runtime.Result;
import scadflow.runtime.ScadException;
import scadflow.runtime.ScadNumber;
import scadflow.runtime.ScadRange;
import scadflow.runtime.ScadValue;
import scadflow.runtime.ScadVector;
import scadflow.runtime.ast.ProcessingException;
import scadflow.runtime.interpreter.ConditionalResult;
import scadflow.runtime.interpreter.InterpreterContext;
import scadflow.runtime.interpreter.ResolvedModule;
import scadflow.runtime.interpreter.ScopeManager;
import scadflow.runtime.interpreter.VariableLookup;
import scadflow.runtime.interpreter.VariableScope;
import scadflow.runtime.module.ModuleException;
import scadflow.runtime.module.ProcessedModuleCall;
import scadflow.runtime.module.ProcessedModuleDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 展开树构建与逐轮展开
 *
 * <p>进入语句块时先登记块内的模块定义，再按顺序执行赋值与 echo，其余语句成为 {@link ScopedNode}。
 * 模块调用、循环与条件分别由各自的轮次展开；一轮展开出的新构造留给后续轮次处理。</p>
 */
public final class TreeExpander {

    private static final Logger LOG = Logger.getLogger(TreeExpander.class.getName());

    public static final String GLOBAL_SCOPE_ID = "global";
    static final String CHILDREN = "children";
    static final String ECHO = "echo";

    private final InterpreterContext context;
    private final ScopeManager scopes;
    private int scopeSeq;
    private long loopIterations;

    public TreeExpander(InterpreterContext context) {
        this.context = context;
        this.scopes = context.getScopes();
    }

    /**
     * 创建全局作用域，预置特殊变量与 PI
     */
    public VariableScope createGlobalScope() {
        VariableScope global = scopes.createScope(GLOBAL_SCOPE_ID);
        scopes.setVariable(global, "$fn", ScadNumber.ZERO);
        scopes.setVariable(global, "$fa", ScadNumber.of(12));
        scopes.setVariable(global, "$fs", ScadNumber.of(2));
        scopes.setVariable(global, "$t", ScadNumber.ZERO);
        scopes.setVariable(global, "PI", ScadNumber.of(Math.PI));
        return global;
    }

    /**
     * 进入语句块
     *
     * @param inherited 外层模块调用的修饰符，语句自身有修饰符时以自身为准；可为 null
     * @return 块内需要继续处理的节点，已禁用的语句被丢弃
     */
    public List<ScopedNode> enterBlock(List<Statement> statements, VariableScope scope, ModuleFrame frame,
                                       StatementModifier inherited) {
        for (Statement stmt : statements) {
            if (stmt instanceof ModuleDefinitionNode) {
                Result<ProcessedModuleDefinition, ModuleException> def =
                        context.getModuleProcessor().processModuleDefinition(stmt);
                if (def.isErr()) {
                    throw def.getError();
                }
                scopes.defineModule(scope, def.getValue());
            }
        }
        List<ScopedNode> result = new ArrayList<>();
        for (Statement stmt : statements) {
            if (stmt instanceof ModuleDefinitionNode || stmt.isDisabled()) {
                continue;
            }
            if (stmt instanceof AssignmentNode) {
                AssignmentNode assign = (AssignmentNode) stmt;
                scopes.setVariable(scope, assign.getName(),
                        context.getEvaluator().evaluateExpression(assign.getValue(), scopes.lookup(scope)));
                continue;
            }
            StatementModifier modifier = stmt.getModifier() != null ? stmt.getModifier() : inherited;
            if (stmt instanceof CallNode) {
                CallNode call = (CallNode) stmt;
                if (ECHO.equals(call.getName())) {
                    echo(call, scope);
                    continue;
                }
                List<ScopedNode> children = Collections.emptyList();
                if (!call.getChildren().isEmpty()) {
                    children = enterBlock(call.getChildren(), newScope("block", scope), frame, modifier);
                }
                result.add(new ScopedNode(call, scope, frame, modifier, children));
            } else {
                result.add(new ScopedNode(stmt, scope, frame, modifier, Collections.<ScopedNode>emptyList()));
            }
        }
        return result;
    }

    /** 展开树中是否还有该种构造 */
    public static boolean hasPending(List<ScopedNode> tree, PendingKind kind) {
        for (ScopedNode n : tree) {
            if (kind.matches(n.getNode()) || hasPending(n.getChildren(), kind)) {
                return true;
            }
        }
        return false;
    }

    // ========== 模块轮次 ==========

    /**
     * 展开模块调用与 children()
     *
     * <p>模块体立即继续展开，因此不受条件保护的递归会在本轮达到深度上限。</p>
     */
    public List<ScopedNode> expandModules(List<ScopedNode> tree) {
        List<ScopedNode> result = new ArrayList<>();
        for (ScopedNode n : tree) {
            Statement node = n.getNode();
            if (node instanceof ModuleInstantiationNode) {
                result.addAll(expandModules(instantiate(n, (ModuleInstantiationNode) node)));
            } else if (node instanceof CallNode && CHILDREN.equals(((CallNode) node).getName())) {
                result.addAll(expandModules(spliceChildren(n, (CallNode) node)));
            } else if (!n.getChildren().isEmpty()) {
                result.add(n.withChildren(expandModules(n.getChildren())));
            } else {
                result.add(n);
            }
        }
        return result;
    }

    private List<ScopedNode> instantiate(ScopedNode site, ModuleInstantiationNode node) {
        ResolvedModule resolved = scopes.findModule(site.getScope(), node.getName());
        if (resolved == null) {
            throw new ModuleException("Module not found: " + node.getName(), node.getName());
        }
        int depth = site.getFrame() == null ? 1 : site.getFrame().getDepth() + 1;
        Result<ProcessedModuleCall, ModuleException> call =
                context.getModuleProcessor().processModuleCall(node, depth);
        if (call.isErr()) {
            throw call.getError();
        }
        ProcessedModuleDefinition definition = resolved.getDefinition();
        VariableScope frameScope = newScope("module_" + node.getName(), resolved.getDefinitionScope());
        ModuleFrame frame = new ModuleFrame(node.getName(), node.getChildren(), site.getScope(), site.getFrame(), depth);
        context.getBinder().bindModuleArguments(definition, call.getValue(), site.getScope(), frameScope);
        scopes.setVariable(frameScope, "$children", ScadNumber.of(countChildren(node.getChildren())));
        LOG.log(Level.FINE, "Expanding module {0} at depth {1}", new Object[]{node.getName(), depth});
        return enterBlock(definition.getBody(), frameScope, frame, site.getModifier());
    }

    private List<ScopedNode> spliceChildren(ScopedNode site, CallNode node) {
        ModuleFrame frame = site.getFrame();
        if (frame == null) {
            LOG.log(Level.WARNING, "children() called outside of a module, ignoring");
            return Collections.emptyList();
        }
        VariableScope blockScope = newScope("children_" + frame.getModuleName(), frame.getCallerScope());
        List<ScopedNode> all = enterBlock(frame.getCallChildren(), blockScope, frame.getCallerFrame(),
                site.getModifier());
        if (node.getArguments().isEmpty()) {
            return all;
        }
        VariableLookup vars = scopes.lookup(site.getScope());
        List<ScopedNode> selected = new ArrayList<>();
        for (Argument arg : node.getArguments()) {
            ScadValue index = context.getEvaluator().evaluateExpression(arg.getValue(), vars);
            for (double i : indices(index)) {
                int idx = (int) i;
                if (idx >= 0 && idx < all.size()) {
                    selected.add(all.get(idx));
                } else {
                    LOG.log(Level.WARNING, "children() index {0} out of range (0..{1})",
                            new Object[]{idx, all.size() - 1});
                }
            }
        }
        return selected;
    }

    private List<Double> indices(ScadValue index) {
        List<Double> out = new ArrayList<>();
        if (index.isNumber()) {
            out.add(index.asDouble());
        } else if (index.isVector()) {
            for (ScadValue v : ((ScadVector) index).getElements()) {
                if (v.isNumber()) out.add(v.asDouble());
            }
        } else if (index.isRange()) {
            ScadRange range = (ScadRange) index;
            if (range.size() > context.getMaxLoopIterations()) {
                throw loopLimit();
            }
            for (long i = 0; i < range.size(); i++) {
                out.add(range.get(i));
            }
        }
        return out;
    }

    private static int countChildren(List<Statement> statements) {
        int n = 0;
        for (Statement s : statements) {
            if (s instanceof AssignmentNode || s instanceof ModuleDefinitionNode || s.isDisabled()) continue;
            if (s instanceof CallNode && ECHO.equals(((CallNode) s).getName())) continue;
            n++;
        }
        return n;
    }

    // ========== 循环轮次 ==========

    /**
     * 展开 for 与 let
     *
     * <p>多个循环变量按笛卡尔积展开，第一个变量在最外层；每次迭代一个新作用域。</p>
     *
     * @throws ProcessingException 本次运行的累计迭代次数超过上限
     */
    public List<ScopedNode> expandLoops(List<ScopedNode> tree) {
        List<ScopedNode> result = new ArrayList<>();
        for (ScopedNode n : tree) {
            Statement node = n.getNode();
            if (node instanceof ForNode) {
                ForNode loop = (ForNode) node;
                List<ScopedNode> expanded = new ArrayList<>();
                iterate(n, loop, 0, n.getScope(), expanded);
                result.addAll(expandLoops(expanded));
            } else if (node instanceof LetNode) {
                LetNode let = (LetNode) node;
                VariableScope letScope = newScope("let", n.getScope());
                for (Binding b : let.getBindings()) {
                    scopes.setVariable(letScope, b.getName(),
                            context.getEvaluator().evaluateExpression(b.getValue(), scopes.lookup(letScope)));
                }
                result.addAll(expandLoops(enterBlock(let.getBody(), letScope, n.getFrame(), n.getModifier())));
            } else if (!n.getChildren().isEmpty()) {
                result.add(n.withChildren(expandLoops(n.getChildren())));
            } else {
                result.add(n);
            }
        }
        return result;
    }

    private void iterate(ScopedNode site, ForNode loop, int bindingIndex, VariableScope outer, List<ScopedNode> out) {
        if (bindingIndex == loop.getBindings().size()) {
            out.addAll(enterBlock(loop.getBody(), outer, site.getFrame(), site.getModifier()));
            return;
        }
        Binding binding = loop.getBindings().get(bindingIndex);
        ScadValue source = context.getEvaluator().evaluateExpression(binding.getValue(), scopes.lookup(outer));
        for (ScadValue element : elements(source)) {
            countIteration();
            VariableScope iterationScope = newScope("for_" + binding.getName(), outer);
            scopes.setVariable(iterationScope, binding.getName(), element);
            iterate(site, loop, bindingIndex + 1, iterationScope, out);
        }
    }

    private List<ScadValue> elements(ScadValue source) {
        if (source.isRange()) {
            ScadRange range = (ScadRange) source;
            long size = range.size();
            if (size > context.getMaxLoopIterations()) {
                throw loopLimit();
            }
            List<ScadValue> values = new ArrayList<>((int) size);
            for (long i = 0; i < size; i++) {
                values.add(ScadNumber.of(range.get(i)));
            }
            return values;
        }
        if (source.isVector()) {
            return ((ScadVector) source).getElements();
        }
        if (source.isUndef()) {
            return Collections.emptyList();
        }
        return Collections.singletonList(source);
    }

    private void countIteration() {
        if (++loopIterations > context.getMaxLoopIterations()) {
            throw loopLimit();
        }
    }

    private ProcessingException loopLimit() {
        return new ProcessingException("Loop iteration limit exceeded (" + context.getMaxLoopIterations() + ")",
                "for_loop");
    }

    // ========== 条件轮次 ==========

    /**
     * 展开 if，选中的分支在新作用域中进入
     *
     * @throws ScadException 条件求值失败
     */
    public List<ScopedNode> expandConditionals(List<ScopedNode> tree) {
        List<ScopedNode> result = new ArrayList<>();
        for (ScopedNode n : tree) {
            Statement node = n.getNode();
            if (node instanceof IfNode) {
                Result<ConditionalResult, ScadException> cond = context.getConditionalProcessor()
                        .processConditional(node, scopes.lookup(n.getScope()));
                if (cond.isErr()) {
                    throw cond.getError();
                }
                ConditionalResult branch = cond.getValue();
                if (branch.getExecutedBranch() == ConditionalResult.Branch.NONE) {
                    continue;
                }
                VariableScope branchScope = newScope("if_" + branch.getExecutedBranch().getLabel(), n.getScope());
                result.addAll(expandConditionals(
                        enterBlock(branch.getResultingNodes(), branchScope, n.getFrame(), n.getModifier())));
            } else if (!n.getChildren().isEmpty()) {
                result.add(n.withChildren(expandConditionals(n.getChildren())));
            } else {
                result.add(n);
            }
        }
        return result;
    }

    // ========== 工具 ==========

    private void echo(CallNode call, VariableScope scope) {
        VariableLookup vars = scopes.lookup(scope);
        StringBuilder sb = new StringBuilder("ECHO: ");
        boolean first = true;
        for (Argument arg : call.getArguments()) {
            if (!first) sb.append(", ");
            first = false;
            if (arg.isNamed()) {
                sb.append(arg.getName()).append(" = ");
            }
            sb.append(context.getEvaluator().evaluateExpression(arg.getValue(), vars));
        }
        String message = sb.toString();
        LOG.info(message);
        context.echo(message);
    }

    private VariableScope newScope(String prefix, VariableScope parent) {
        return scopes.createScope(prefix + "_" + (++scopeSeq), parent);
    }
}
