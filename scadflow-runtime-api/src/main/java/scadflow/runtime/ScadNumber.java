package scadflow.runtime;

/**
 * 数值（64 位浮点数）
 */
public final class ScadNumber extends ScadValue {

    public static final ScadNumber ZERO = new ScadNumber(0.0);
    public static final ScadNumber ONE = new ScadNumber(1.0);

    /** 获取 ScadNumber 实例，常见值从缓存取 */
    public static ScadNumber of(double value) {
        if (value == 0.0 && Double.doubleToRawLongBits(value) == 0L) return ZERO;
        if (value == 1.0) return ONE;
        return new ScadNumber(value);
    }

    private final double value;

    private ScadNumber(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "number";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return value != 0.0 && !Double.isNaN(value);
    }

    @Override
    public boolean isNumber() {
        return true;
    }

    @Override
    public double asDouble() {
        return value;
    }

    @Override
    public boolean valueEquals(ScadValue other) {
        return other != null && other.isNumber() && value == other.asDouble();
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value == 0.0 ? 0.0 : value);
    }

    /** 整数值不带小数部分输出 */
    @Override
    public String toString() {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
