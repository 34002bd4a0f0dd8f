package scadflow.runtime.module;

import com.scadflow.compiler.ast.expr.Expression;

/**
 * 调用实参，name 为 null 表示位置参数
 */
public final class ModuleArgument {
    private final String name;
    private final Expression value;

    public ModuleArgument(String name, Expression value) {
        this.name = name;
        this.value = value;
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
}
