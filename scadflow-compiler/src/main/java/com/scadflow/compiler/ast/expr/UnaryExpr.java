package com.scadflow.compiler.ast.expr;

import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.SourceLocation;

/**
 * 一元表达式（- + !）
 */
public class UnaryExpr extends Expression {
    private final String operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, String operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public String getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public String getType() {
        return "unary_expression";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnary(this, context);
    }

    @Override
    public String toString() {
        return operator + operand;
    }
}
