package scadflow.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 向量值（不可变有序列表）
 */
public final class ScadVector extends ScadValue {

    public static final ScadVector EMPTY = new ScadVector(Collections.<ScadValue>emptyList());

    public static ScadVector of(List<? extends ScadValue> elements) {
        if (elements.isEmpty()) return EMPTY;
        return new ScadVector(Collections.unmodifiableList(new ArrayList<ScadValue>(elements)));
    }

    public static ScadVector of(ScadValue... elements) {
        return of(Arrays.asList(elements));
    }

    /** 由数值构造向量 */
    public static ScadVector ofNumbers(double... numbers) {
        List<ScadValue> items = new ArrayList<>(numbers.length);
        for (double n : numbers) {
            items.add(ScadNumber.of(n));
        }
        return of(items);
    }

    private final List<ScadValue> elements;

    private ScadVector(List<ScadValue> elements) {
        this.elements = elements;
    }

    public List<ScadValue> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    /** 越界返回 undef */
    public ScadValue get(int index) {
        if (index < 0 || index >= elements.size()) return ScadUndef.UNDEF;
        return elements.get(index);
    }

    /** 所有元素都是数值 */
    public boolean isNumeric() {
        for (ScadValue v : elements) {
            if (!v.isNumber()) return false;
        }
        return true;
    }

    @Override
    public String getTypeName() {
        return "vector";
    }

    @Override
    public Object toJavaValue() {
        List<Object> list = new ArrayList<>(elements.size());
        for (ScadValue v : elements) {
            list.add(v.toJavaValue());
        }
        return list;
    }

    @Override
    public boolean isTruthy() {
        return !elements.isEmpty();
    }

    @Override
    public boolean isVector() {
        return true;
    }

    @Override
    public boolean valueEquals(ScadValue other) {
        if (other == null || !other.isVector()) return false;
        List<ScadValue> others = ((ScadVector) other).elements;
        if (others.size() != elements.size()) return false;
        for (int i = 0; i < elements.size(); i++) {
            if (!elements.get(i).valueEquals(others.get(i))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i));
        }
        return sb.append(']').toString();
    }
}
