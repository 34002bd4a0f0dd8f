package scadflow.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 范围值 [start:step:end]（闭区间）
 *
 * <p>步长为 0、方向与步长相反或含 NaN 的范围为空。元素按需计算，不物化。</p>
 */
public final class ScadRange extends ScadValue {

    private final double start;
    private final double step;
    private final double end;

    public ScadRange(double start, double step, double end) {
        this.start = start;
        this.step = step;
        this.end = end;
    }

    public ScadRange(double start, double end) {
        this(start, 1.0, end);
    }

    public double getStart() {
        return start;
    }

    public double getStep() {
        return step;
    }

    public double getEnd() {
        return end;
    }

    /** 元素个数，超出 long 范围时为 Long.MAX_VALUE */
    public long size() {
        if (Double.isNaN(start) || Double.isNaN(step) || Double.isNaN(end) || step == 0.0) return 0;
        if (Double.isInfinite(start) || Double.isInfinite(end)) return 0;
        double span = (end - start) / step;
        if (span < 0) return 0;
        // 容忍浮点误差
        double count = Math.floor(span + 1e-9) + 1;
        return count >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) count;
    }

    public double get(long index) {
        return start + step * index;
    }

    @Override
    public String getTypeName() {
        return "range";
    }

    @Override
    public Object toJavaValue() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("start", start);
        map.put("step", step);
        map.put("end", end);
        return map;
    }

    @Override
    public boolean isTruthy() {
        return true;
    }

    @Override
    public boolean isRange() {
        return true;
    }

    @Override
    public boolean valueEquals(ScadValue other) {
        if (other == null || !other.isRange()) return false;
        ScadRange r = (ScadRange) other;
        return start == r.start && step == r.step && end == r.end;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(start) * 31 * 31 + Double.hashCode(step) * 31 + Double.hashCode(end);
    }

    @Override
    public String toString() {
        if (step == 1.0) {
            return "[" + ScadNumber.of(start) + " : " + ScadNumber.of(end) + "]";
        }
        return "[" + ScadNumber.of(start) + " : " + ScadNumber.of(step) + " : " + ScadNumber.of(end) + "]";
    }
}
