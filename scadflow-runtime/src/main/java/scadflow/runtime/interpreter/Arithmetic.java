package scadflow.runtime.interpreter;

import scadflow.runtime.ScadBoolean;
import scadflow.runtime.ScadNumber;
import scadflow.runtime.ScadUndef;
import scadflow.runtime.ScadValue;
import scadflow.runtime.ScadVector;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.IntPredicate;

/**
 * 按值类型逐一匹配的算术与比较规则
 *
 * <ul>
 *   <li>数字 op 数字：IEEE 双精度运算</li>
 *   <li>向量 ± 向量：等长时逐元素，否则 undef</li>
 *   <li>向量 * 数字、数字 * 向量、向量 / 数字：逐元素缩放</li>
 *   <li>数值向量 * 数值向量：等长时为点积</li>
 *   <li>比较：数字之间或字符串之间，其余为 undef</li>
 * </ul>
 */
final class Arithmetic {

    private Arithmetic() {
    }

    static ScadValue add(ScadValue l, ScadValue r) {
        return elementwise(l, r, Double::sum);
    }

    static ScadValue subtract(ScadValue l, ScadValue r) {
        return elementwise(l, r, (a, b) -> a - b);
    }

    static ScadValue multiply(ScadValue l, ScadValue r) {
        if (l.isNumber() && r.isNumber()) {
            return ScadNumber.of(l.asDouble() * r.asDouble());
        }
        if (l.isVector() && r.isNumber()) {
            return scale((ScadVector) l, r.asDouble(), (a, b) -> a * b);
        }
        if (l.isNumber() && r.isVector()) {
            return scale((ScadVector) r, l.asDouble(), (a, b) -> a * b);
        }
        if (l.isVector() && r.isVector()) {
            ScadVector a = (ScadVector) l;
            ScadVector b = (ScadVector) r;
            if (a.size() != b.size() || !a.isNumeric() || !b.isNumeric()) {
                return ScadUndef.UNDEF;
            }
            double dot = 0;
            for (int i = 0; i < a.size(); i++) {
                dot += a.get(i).asDouble() * b.get(i).asDouble();
            }
            return ScadNumber.of(dot);
        }
        return ScadUndef.UNDEF;
    }

    static ScadValue divide(ScadValue l, ScadValue r) {
        if (l.isNumber() && r.isNumber()) {
            return ScadNumber.of(l.asDouble() / r.asDouble());
        }
        if (l.isVector() && r.isNumber()) {
            return scale((ScadVector) l, r.asDouble(), (a, b) -> a / b);
        }
        return ScadUndef.UNDEF;
    }

    static ScadValue modulo(ScadValue l, ScadValue r) {
        if (l.isNumber() && r.isNumber()) {
            return ScadNumber.of(l.asDouble() % r.asDouble());
        }
        return ScadUndef.UNDEF;
    }

    static ScadValue negate(ScadValue v) {
        if (v.isNumber()) {
            return ScadNumber.of(-v.asDouble());
        }
        if (v.isVector()) {
            List<ScadValue> items = new ArrayList<>();
            for (ScadValue e : ((ScadVector) v).getElements()) {
                items.add(negate(e));
            }
            return ScadVector.of(items);
        }
        return ScadUndef.UNDEF;
    }

    static ScadValue compare(ScadValue l, ScadValue r, IntPredicate test) {
        if (l.isNumber() && r.isNumber()) {
            double a = l.asDouble();
            double b = r.asDouble();
            if (Double.isNaN(a) || Double.isNaN(b)) return ScadBoolean.FALSE;
            return ScadBoolean.of(test.test(a < b ? -1 : (a > b ? 1 : 0)));
        }
        if (l.isString() && r.isString()) {
            return ScadBoolean.of(test.test(Integer.signum(l.asString().compareTo(r.asString()))));
        }
        return ScadUndef.UNDEF;
    }

    private static ScadValue elementwise(ScadValue l, ScadValue r, DoubleBinaryOperator op) {
        if (l.isNumber() && r.isNumber()) {
            return ScadNumber.of(op.applyAsDouble(l.asDouble(), r.asDouble()));
        }
        if (l.isVector() && r.isVector()) {
            ScadVector a = (ScadVector) l;
            ScadVector b = (ScadVector) r;
            if (a.size() != b.size()) {
                return ScadUndef.UNDEF;
            }
            List<ScadValue> items = new ArrayList<>(a.size());
            for (int i = 0; i < a.size(); i++) {
                ScadValue item = elementwise(a.get(i), b.get(i), op);
                if (item.isUndef()) return ScadUndef.UNDEF;
                items.add(item);
            }
            return ScadVector.of(items);
        }
        return ScadUndef.UNDEF;
    }

    private static ScadValue scale(ScadVector v, double factor, DoubleBinaryOperator op) {
        List<ScadValue> items = new ArrayList<>(v.size());
        for (ScadValue e : v.getElements()) {
            if (e.isNumber()) {
                items.add(ScadNumber.of(op.applyAsDouble(e.asDouble(), factor)));
            } else if (e.isVector()) {
                items.add(scale((ScadVector) e, factor, op));
            } else {
                return ScadUndef.UNDEF;
            }
        }
        return ScadVector.of(items);
    }
}
