package com.scadflow.compiler.ast;

import com.scadflow.compiler.ast.expr.Expression;

/**
 * 变量绑定 name = expr（for 循环变量、let 绑定）
 */
public final class Binding {
    private final String name;
    private final Expression value;

    public Binding(String name, Expression value) {
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }
}
