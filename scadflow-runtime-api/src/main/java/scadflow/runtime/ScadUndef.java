package scadflow.runtime;

/**
 * undef 值（单例）
 *
 * <p>未赋值参数、越界下标以及无意义的算术运算结果都为 undef。</p>
 */
public final class ScadUndef extends ScadValue {

    public static final ScadUndef UNDEF = new ScadUndef();

    private ScadUndef() {
    }

    @Override
    public String getTypeName() {
        return "undef";
    }

    @Override
    public Object toJavaValue() {
        return null;
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public boolean isUndef() {
        return true;
    }

    @Override
    public boolean valueEquals(ScadValue other) {
        return other != null && other.isUndef();
    }

    @Override
    public int hashCode() {
        return 0;
    }

    @Override
    public String toString() {
        return "undef";
    }
}
