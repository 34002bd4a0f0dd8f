package scadflow.runtime.builtin;

import scadflow.runtime.ScadValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内置调用签名：位置参数顺序、仅命名参数、默认值
 */
public final class Signature {
    private final String name;
    private final List<String> positional;
    private final Set<String> namedOnly;
    private final Map<String, ScadValue> defaults;

    private Signature(String name, List<String> positional, Set<String> namedOnly, Map<String, ScadValue> defaults) {
        this.name = name;
        this.positional = Collections.unmodifiableList(positional);
        this.namedOnly = Collections.unmodifiableSet(namedOnly);
        this.defaults = Collections.unmodifiableMap(defaults);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<String> getPositional() {
        return positional;
    }

    /** 第 index 个位置参数的名称，超出范围返回 null */
    public String positionalName(int index) {
        return index >= 0 && index < positional.size() ? positional.get(index) : null;
    }

    /** 全部参数名：位置参数在前 */
    public Set<String> parameterNames() {
        Set<String> all = new LinkedHashSet<>(positional);
        all.addAll(namedOnly);
        return all;
    }

    public boolean accepts(String parameterName) {
        return positional.contains(parameterName) || namedOnly.contains(parameterName);
    }

    /** 默认值，未声明返回 null */
    public ScadValue defaultValue(String parameterName) {
        return defaults.get(parameterName);
    }

    public static final class Builder {
        private final String name;
        private final List<String> positional = new ArrayList<>();
        private final Set<String> namedOnly = new LinkedHashSet<>();
        private final Map<String, ScadValue> defaults = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder positional(String... names) {
            positional.addAll(Arrays.asList(names));
            return this;
        }

        public Builder named(String... names) {
            namedOnly.addAll(Arrays.asList(names));
            return this;
        }

        public Builder defaultValue(String parameter, ScadValue value) {
            defaults.put(parameter, value);
            return this;
        }

        public Signature build() {
            return new Signature(name, positional, namedOnly, defaults);
        }
    }
}
