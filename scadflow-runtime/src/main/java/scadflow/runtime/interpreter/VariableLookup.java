package scadflow.runtime.interpreter;

import scadflow.runtime.ScadValue;

import java.util.Map;

/**
 * 求值器使用的变量查找视图
 */
@FunctionalInterface
public interface VariableLookup {

    /**
     * 查找变量
     *
     * @return 变量值；未定义返回 null（与已定义为 undef 区分）
     */
    ScadValue lookup(String name);

    /** 不含任何变量 */
    static VariableLookup empty() {
        return name -> null;
    }

    /**
     * 以 Map 为变量表，值可以是 ScadValue 或普通 Java 值
     */
    static VariableLookup of(Map<String, ?> variables) {
        return name -> {
            if (!variables.containsKey(name)) return null;
            return ScadValue.fromJava(variables.get(name));
        };
    }
}
