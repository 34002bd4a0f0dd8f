package scadflow.runtime.interpreter;

import com.scadflow.compiler.ast.Argument;
import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.expr.*;
import scadflow.runtime.ScadBoolean;
import scadflow.runtime.ScadNumber;
import scadflow.runtime.ScadRange;
import scadflow.runtime.ScadString;
import scadflow.runtime.ScadUndef;
import scadflow.runtime.ScadValue;
import scadflow.runtime.ScadVector;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 表达式求值器
 *
 * <p>只执行 AST 已确定的树形结构。&amp;&amp; 与 || 两侧都会求值（不短路），
 * 类型不匹配的算术与比较结果为 undef，未解析的标识符和未知运算符抛出
 * {@link EvaluationException}。</p>
 */
public final class ExpressionEvaluator implements AstVisitor<ScadValue, VariableLookup> {

    public ScadValue evaluateExpression(Expression expr, VariableLookup vars) {
        if (expr == null) {
            throw new EvaluationException("Cannot evaluate a missing expression");
        }
        ScadValue value = expr.accept(this, vars);
        if (value == null) {
            throw new EvaluationException("Unsupported expression type: " + expr.getType());
        }
        return value;
    }

    /** 以普通 Map 为变量表求值 */
    public ScadValue evaluateExpression(Expression expr, Map<String, ?> vars) {
        return evaluateExpression(expr, VariableLookup.of(vars));
    }

    // ============ 基本表达式 ============

    @Override
    public ScadValue visitLiteral(LiteralExpr node, VariableLookup vars) {
        switch (node.getKind()) {
            case NUMBER:
                return ScadNumber.of(((Number) node.getValue()).doubleValue());
            case STRING:
                return ScadString.of((String) node.getValue());
            case BOOLEAN:
                return ScadBoolean.of((Boolean) node.getValue());
            default:
                return ScadUndef.UNDEF;
        }
    }

    @Override
    public ScadValue visitIdentifier(IdentifierExpr node, VariableLookup vars) {
        ScadValue value = vars.lookup(node.getName());
        if (value == null) {
            throw new EvaluationException("Variable not found: " + node.getName());
        }
        return value;
    }

    @Override
    public ScadValue visitBinary(BinaryExpr node, VariableLookup vars) {
        if (node.getLeft() == null || node.getRight() == null) {
            throw new EvaluationException("Binary expression missing left or right operand");
        }
        ScadValue left = evaluateExpression(node.getLeft(), vars);
        ScadValue right = evaluateExpression(node.getRight(), vars);
        return applyBinary(node.getOperator(), left, right);
    }

    @Override
    public ScadValue visitUnary(UnaryExpr node, VariableLookup vars) {
        ScadValue operand = evaluateExpression(node.getOperand(), vars);
        switch (node.getOperator()) {
            case "!":
                return ScadBoolean.of(!operand.isTruthy());
            case "-":
                return Arithmetic.negate(operand);
            case "+":
                return operand.isNumber() || operand.isVector() ? operand : ScadUndef.UNDEF;
            default:
                throw new EvaluationException("Unknown unary operator: " + node.getOperator());
        }
    }

    @Override
    public ScadValue visitTernary(TernaryExpr node, VariableLookup vars) {
        ScadValue condition = evaluateExpression(node.getCondition(), vars);
        return condition.isTruthy()
                ? evaluateExpression(node.getThenExpr(), vars)
                : evaluateExpression(node.getElseExpr(), vars);
    }

    // ============ 向量与范围 ============

    @Override
    public ScadValue visitVector(VectorExpr node, VariableLookup vars) {
        List<ScadValue> items = new ArrayList<>(node.getElements().size());
        for (Expression e : node.getElements()) {
            items.add(evaluateExpression(e, vars));
        }
        return ScadVector.of(items);
    }

    @Override
    public ScadValue visitRange(RangeExpr node, VariableLookup vars) {
        ScadValue start = evaluateExpression(node.getStart(), vars);
        ScadValue end = evaluateExpression(node.getEnd(), vars);
        ScadValue step = node.getStep() != null ? evaluateExpression(node.getStep(), vars) : ScadNumber.ONE;
        if (!start.isNumber() || !end.isNumber() || !step.isNumber()) {
            throw new EvaluationException("Range bounds must be numbers: " + node);
        }
        return new ScadRange(start.asDouble(), step.asDouble(), end.asDouble());
    }

    @Override
    public ScadValue visitIndex(IndexExpr node, VariableLookup vars) {
        ScadValue target = evaluateExpression(node.getTarget(), vars);
        ScadValue index = evaluateExpression(node.getIndex(), vars);
        if (!index.isNumber() || Double.isNaN(index.asDouble())) {
            return ScadUndef.UNDEF;
        }
        int i = (int) Math.floor(index.asDouble());
        if (target.isVector()) {
            return ((ScadVector) target).get(i);
        }
        if (target.isString()) {
            String s = target.asString();
            return i >= 0 && i < s.length() ? ScadString.of(String.valueOf(s.charAt(i))) : ScadUndef.UNDEF;
        }
        if (target.isRange()) {
            ScadRange r = (ScadRange) target;
            return i >= 0 && i < r.size() ? ScadNumber.of(r.get(i)) : ScadUndef.UNDEF;
        }
        return ScadUndef.UNDEF;
    }

    @Override
    public ScadValue visitMember(MemberExpr node, VariableLookup vars) {
        ScadValue target = evaluateExpression(node.getTarget(), vars);
        if (!target.isVector()) {
            return ScadUndef.UNDEF;
        }
        switch (node.getMember()) {
            case "x": return ((ScadVector) target).get(0);
            case "y": return ((ScadVector) target).get(1);
            case "z": return ((ScadVector) target).get(2);
            default: return ScadUndef.UNDEF;
        }
    }

    @Override
    public ScadValue visitFunctionCall(CallExpr node, VariableLookup vars) {
        List<ScadValue> args = new ArrayList<>(node.getArguments().size());
        for (Argument arg : node.getArguments()) {
            args.add(evaluateExpression(arg.getValue(), vars));
        }
        return BuiltinFunctions.call(node.getName(), args);
    }

    // ============ 运算符 ============

    /**
     * 对已求值的操作数应用二元运算符
     *
     * @throws EvaluationException 未知运算符
     */
    public static ScadValue applyBinary(String operator, ScadValue left, ScadValue right) {
        switch (operator) {
            case "+": return Arithmetic.add(left, right);
            case "-": return Arithmetic.subtract(left, right);
            case "*": return Arithmetic.multiply(left, right);
            case "/": return Arithmetic.divide(left, right);
            case "%": return Arithmetic.modulo(left, right);
            case "<": return Arithmetic.compare(left, right, c -> c < 0);
            case ">": return Arithmetic.compare(left, right, c -> c > 0);
            case "<=": return Arithmetic.compare(left, right, c -> c <= 0);
            case ">=": return Arithmetic.compare(left, right, c -> c >= 0);
            case "==": return ScadBoolean.of(left.valueEquals(right));
            case "!=": return ScadBoolean.of(!left.valueEquals(right));
            case "&&": return ScadBoolean.of(left.isTruthy() && right.isTruthy());
            case "||": return ScadBoolean.of(left.isTruthy() || right.isTruthy());
            default:
                throw new EvaluationException("Unknown binary operator: " + operator);
        }
    }
}
