package com.scadflow.compiler.ast.expr;

import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.SourceLocation;

/**
 * 二元表达式
 *
 * <p>运算符保留源码符号（+ - * / % &lt; &gt; &lt;= &gt;= == != &amp;&amp; ||），
 * 由求值器检查是否支持。</p>
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final String operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, String operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public String getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public String getType() {
        return "binary_expression";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinary(this, context);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
