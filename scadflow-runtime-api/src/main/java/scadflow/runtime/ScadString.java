package scadflow.runtime;

/**
 * 字符串值
 */
public final class ScadString extends ScadValue {

    public static final ScadString EMPTY = new ScadString("");

    public static ScadString of(String value) {
        if (value == null || value.isEmpty()) return EMPTY;
        return new ScadString(value);
    }

    private final String value;

    private ScadString(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public int length() {
        return value.length();
    }

    @Override
    public String getTypeName() {
        return "string";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return !value.isEmpty();
    }

    @Override
    public boolean isString() {
        return true;
    }

    @Override
    public String asString() {
        return value;
    }

    @Override
    public boolean valueEquals(ScadValue other) {
        return other != null && other.isString() && value.equals(((ScadString) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    /** 带引号的字面量形式，asString() 返回原始内容 */
    @Override
    public String toString() {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
