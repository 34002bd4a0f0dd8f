package scadflow.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * ScadFlow 运行时值的基类
 *
 * <p>封闭的值类型：数字、字符串、布尔、向量、范围和 undef。
 * 运算符语义由求值器按类型逐一匹配，不做隐式类型转换。</p>
 */
public abstract class ScadValue {

    ScadValue() {
    }

    /**
     * 将 Java 值转换为 ScadValue
     *
     * @param javaValue Java 对象
     * @return 对应的 ScadValue，不支持的类型返回 undef
     */
    public static ScadValue fromJava(Object javaValue) {
        if (javaValue == null) {
            return ScadUndef.UNDEF;
        }
        if (javaValue instanceof ScadValue) {
            return (ScadValue) javaValue;
        }
        if (javaValue instanceof Number) {
            return ScadNumber.of(((Number) javaValue).doubleValue());
        }
        if (javaValue instanceof Boolean) {
            return ScadBoolean.of((Boolean) javaValue);
        }
        if (javaValue instanceof CharSequence) {
            return ScadString.of(javaValue.toString());
        }
        if (javaValue instanceof Iterable) {
            List<ScadValue> items = new ArrayList<>();
            for (Object item : (Iterable<?>) javaValue) {
                items.add(fromJava(item));
            }
            return ScadVector.of(items);
        }
        if (javaValue instanceof double[]) {
            List<ScadValue> items = new ArrayList<>();
            for (double d : (double[]) javaValue) {
                items.add(ScadNumber.of(d));
            }
            return ScadVector.of(items);
        }
        return ScadUndef.UNDEF;
    }

    /** 类型名（number / string / boolean / vector / range / undef） */
    public abstract String getTypeName();

    /** 转换为普通 Java 值（Double、String、Boolean、List、Map 或 null） */
    public abstract Object toJavaValue();

    /** 条件判断中的真值 */
    public abstract boolean isTruthy();

    public boolean isNumber() {
        return false;
    }

    public boolean isString() {
        return false;
    }

    public boolean isBoolean() {
        return false;
    }

    public boolean isVector() {
        return false;
    }

    public boolean isRange() {
        return false;
    }

    public boolean isUndef() {
        return false;
    }

    public double asDouble() {
        throw new ScadException("Cannot convert " + getTypeName() + " to number");
    }

    public int asInt() {
        return (int) asDouble();
    }

    public String asString() {
        return toString();
    }

    /** 结构相等（== 运算符语义） */
    public abstract boolean valueEquals(ScadValue other);

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ScadValue)) return false;
        return valueEquals((ScadValue) obj);
    }

    @Override
    public abstract int hashCode();
}
