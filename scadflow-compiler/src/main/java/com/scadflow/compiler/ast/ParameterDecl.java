package com.scadflow.compiler.ast;

import com.scadflow.compiler.ast.expr.Expression;

/**
 * 模块形参声明：名称、默认值（可为 null）、可选类型标注
 */
public final class ParameterDecl {
    private final String name;
    private final Expression defaultValue;
    private final String type;

    public ParameterDecl(String name, Expression defaultValue, String type) {
        this.name = name;
        this.defaultValue = defaultValue;
        this.type = type;
    }

    public ParameterDecl(String name, Expression defaultValue) {
        this(name, defaultValue, null);
    }

    public String getName() {
        return name;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public String getTypeAnnotation() {
        return type;
    }
}
