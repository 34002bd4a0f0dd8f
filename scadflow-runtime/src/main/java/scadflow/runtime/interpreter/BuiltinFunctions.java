package scadflow.runtime.interpreter;

import scadflow.runtime.ScadNumber;
import scadflow.runtime.ScadString;
import scadflow.runtime.ScadUndef;
import scadflow.runtime.ScadValue;
import scadflow.runtime.ScadVector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;

/**
 * 表达式中可调用的内置函数
 *
 * <p>三角函数以角度为单位。参数类型不符时返回 undef。</p>
 */
public final class BuiltinFunctions {

    private static final Map<String, Function<List<ScadValue>, ScadValue>> FUNCTIONS;

    static {
        Map<String, Function<List<ScadValue>, ScadValue>> map = new HashMap<>();

        // 数学
        unary(map, "abs", Math::abs);
        unary(map, "sign", Math::signum);
        unary(map, "sqrt", Math::sqrt);
        unary(map, "exp", Math::exp);
        unary(map, "ln", Math::log);
        unary(map, "floor", Math::floor);
        unary(map, "ceil", Math::ceil);
        unary(map, "round", BuiltinFunctions::roundHalfAwayFromZero);
        map.put("pow", args -> binary(args, Math::pow));
        map.put("log", args -> {
            if (args.size() == 2) {
                return binary(args, (b, x) -> Math.log(x) / Math.log(b));
            }
            return unaryApply(args, Math::log10);
        });
        map.put("min", args -> extremum(args, true));
        map.put("max", args -> extremum(args, false));

        // 三角（角度制）
        unary(map, "sin", d -> Math.sin(Math.toRadians(d)));
        unary(map, "cos", d -> Math.cos(Math.toRadians(d)));
        unary(map, "tan", d -> Math.tan(Math.toRadians(d)));
        unary(map, "asin", d -> Math.toDegrees(Math.asin(d)));
        unary(map, "acos", d -> Math.toDegrees(Math.acos(d)));
        unary(map, "atan", d -> Math.toDegrees(Math.atan(d)));
        map.put("atan2", args -> binary(args, (y, x) -> Math.toDegrees(Math.atan2(y, x))));

        // 向量与字符串
        map.put("len", args -> {
            if (args.size() != 1) return ScadUndef.UNDEF;
            ScadValue v = args.get(0);
            if (v.isVector()) return ScadNumber.of(((ScadVector) v).size());
            if (v.isString()) return ScadNumber.of(((ScadString) v).length());
            return ScadUndef.UNDEF;
        });
        map.put("norm", args -> {
            if (args.size() != 1 || !args.get(0).isVector()) return ScadUndef.UNDEF;
            ScadVector v = (ScadVector) args.get(0);
            if (!v.isNumeric()) return ScadUndef.UNDEF;
            double sum = 0;
            for (ScadValue e : v.getElements()) {
                sum += e.asDouble() * e.asDouble();
            }
            return ScadNumber.of(Math.sqrt(sum));
        });
        map.put("str", args -> {
            StringBuilder sb = new StringBuilder();
            for (ScadValue v : args) {
                sb.append(v.asString());
            }
            return ScadString.of(sb.toString());
        });
        map.put("concat", args -> {
            List<ScadValue> items = new ArrayList<>();
            for (ScadValue v : args) {
                if (v.isVector()) {
                    items.addAll(((ScadVector) v).getElements());
                } else {
                    items.add(v);
                }
            }
            return ScadVector.of(items);
        });

        FUNCTIONS = Collections.unmodifiableMap(map);
    }

    private BuiltinFunctions() {
    }

    public static boolean isDefined(String name) {
        return FUNCTIONS.containsKey(name);
    }

    public static Set<String> names() {
        return FUNCTIONS.keySet();
    }

    /**
     * 调用内置函数
     *
     * @throws EvaluationException 函数不存在
     */
    public static ScadValue call(String name, List<ScadValue> args) {
        Function<List<ScadValue>, ScadValue> fn = FUNCTIONS.get(name);
        if (fn == null) {
            throw new EvaluationException("Unknown function: " + name);
        }
        return fn.apply(args);
    }

    private static void unary(Map<String, Function<List<ScadValue>, ScadValue>> map, String name,
                              DoubleUnaryOperator op) {
        map.put(name, args -> unaryApply(args, op));
    }

    private static ScadValue unaryApply(List<ScadValue> args, DoubleUnaryOperator op) {
        if (args.size() != 1 || !args.get(0).isNumber()) return ScadUndef.UNDEF;
        return ScadNumber.of(op.applyAsDouble(args.get(0).asDouble()));
    }

    private static ScadValue binary(List<ScadValue> args, java.util.function.DoubleBinaryOperator op) {
        if (args.size() != 2 || !args.get(0).isNumber() || !args.get(1).isNumber()) return ScadUndef.UNDEF;
        return ScadNumber.of(op.applyAsDouble(args.get(0).asDouble(), args.get(1).asDouble()));
    }

    /** 多个数值参数，或单个数值向量参数 */
    private static ScadValue extremum(List<ScadValue> args, boolean min) {
        List<ScadValue> values = args;
        if (args.size() == 1 && args.get(0).isVector()) {
            values = ((ScadVector) args.get(0)).getElements();
        }
        if (values.isEmpty()) return ScadUndef.UNDEF;
        double result = min ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        for (ScadValue v : values) {
            if (!v.isNumber()) return ScadUndef.UNDEF;
            result = min ? Math.min(result, v.asDouble()) : Math.max(result, v.asDouble());
        }
        return ScadNumber.of(result);
    }

    private static double roundHalfAwayFromZero(double d) {
        return Math.signum(d) * Math.floor(Math.abs(d) + 0.5);
    }
}
