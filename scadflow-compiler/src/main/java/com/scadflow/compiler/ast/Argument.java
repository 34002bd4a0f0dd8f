package com.scadflow.compiler.ast;

import com.scadflow.compiler.ast.expr.Expression;

/**
 * 调用参数：name 为 null 表示位置参数
 */
public final class Argument {
    private final String name;
    private final Expression value;

    public Argument(String name, Expression value) {
        this.name = name;
        this.value = value;
    }

    public static Argument positional(Expression value) {
        return new Argument(null, value);
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isNamed() {
        return name != null;
    }

    @Override
    public String toString() {
        return name != null ? name + "=" + value : String.valueOf(value);
    }
}
