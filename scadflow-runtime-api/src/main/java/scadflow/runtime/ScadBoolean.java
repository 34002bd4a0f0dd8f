package scadflow.runtime;

/**
 * 布尔值
 */
public final class ScadBoolean extends ScadValue {

    public static final ScadBoolean TRUE = new ScadBoolean(true);
    public static final ScadBoolean FALSE = new ScadBoolean(false);

    public static ScadBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    private final boolean value;

    private ScadBoolean(boolean value) {
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "boolean";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return value;
    }

    @Override
    public boolean isBoolean() {
        return true;
    }

    @Override
    public boolean valueEquals(ScadValue other) {
        return other != null && other.isBoolean() && value == ((ScadBoolean) other).value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
