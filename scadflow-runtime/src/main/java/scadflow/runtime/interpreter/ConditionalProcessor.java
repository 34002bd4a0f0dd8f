package scadflow.runtime.interpreter;

import com.scadflow.compiler.ast.AstNode;
import com.scadflow.compiler.ast.stmt.IfNode;
import com.scadflow.compiler.ast.stmt.Statement;
import scadflow.runtime.Result;
import scadflow.runtime.ScadException;
import scadflow.runtime.ScadValue;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 条件处理器：求值 if 条件并选出分支
 *
 * <p>条件中的任何求值错误都使整个处理失败，不会按 false 处理。</p>
 */
public final class ConditionalProcessor {

    private final ExpressionEvaluator evaluator;

    public ConditionalProcessor(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public ConditionalProcessor() {
        this(new ExpressionEvaluator());
    }

    public Result<ConditionalResult, ScadException> processConditional(AstNode node, VariableLookup vars) {
        long start = System.nanoTime();
        if (!(node instanceof IfNode)) {
            String type = node != null ? node.getType() : null;
            return Result.err(new EvaluationException("Unsupported conditional node type: " + type));
        }
        IfNode ifNode = (IfNode) node;
        try {
            ScadValue value = evaluator.evaluateExpression(ifNode.getCondition(), vars);
            boolean truthy = value.isTruthy();
            ConditionalResult.Branch branch;
            List<Statement> selected;
            if (truthy) {
                branch = ConditionalResult.Branch.THEN;
                selected = ifNode.getThenBody();
            } else if (ifNode.hasElse()) {
                branch = ConditionalResult.Branch.ELSE;
                selected = ifNode.getElseBody();
            } else {
                branch = ConditionalResult.Branch.NONE;
                selected = Collections.emptyList();
            }
            double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
            return Result.ok(new ConditionalResult(truthy, value, branch, selected, elapsedMs));
        } catch (ScadException e) {
            return Result.err(e);
        }
    }

    /** 以普通 Map 为变量表处理 */
    public Result<ConditionalResult, ScadException> processConditional(AstNode node, Map<String, ?> vars) {
        return processConditional(node, VariableLookup.of(vars));
    }
}
