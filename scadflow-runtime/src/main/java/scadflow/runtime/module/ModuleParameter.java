package scadflow.runtime.module;

import com.scadflow.compiler.ast.expr.Expression;

/**
 * 模块形参（名称、默认值表达式、可选类型）
 */
public final class ModuleParameter {
    private final String name;
    private final Expression defaultValue;
    private final String type;

    public ModuleParameter(String name, Expression defaultValue, String type) {
        this.name = name;
        this.defaultValue = defaultValue;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    /** 未声明默认值时为 null */
    public Expression getDefaultValue() {
        return defaultValue;
    }

    public String getType() {
        return type;
    }
}
