package scadflow.runtime.geometry;

import com.scadflow.compiler.ast.NodeCategory;
import com.scadflow.compiler.ast.StatementModifier;
import com.scadflow.compiler.ast.stmt.CallNode;
import scadflow.runtime.Result;
import scadflow.runtime.ScadException;
import scadflow.runtime.ScadNumber;
import scadflow.runtime.ScadValue;
import scadflow.runtime.ScadVector;
import scadflow.runtime.builtin.BuiltinSignatures;
import scadflow.runtime.builtin.Signature;
import scadflow.runtime.expand.ScopedNode;
import scadflow.runtime.interpreter.InterpreterContext;
import scadflow.runtime.interpreter.VariableLookup;
import scadflow.runtime.perf.PerformanceTracker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 默认几何生成器
 *
 * <p>每个内置几何调用生成一个 {@link GeometryNode}，参数按签名绑定并校验尺寸。
 * 树中存在 ! 修饰的节点时只输出第一个这样的子树。</p>
 */
public final class DefaultGeometryEmitter implements GeometryEmitter {

    private static final Logger LOG = Logger.getLogger(DefaultGeometryEmitter.class.getName());

    private static final String[] RESOLUTION_VARIABLES = {"$fn", "$fa", "$fs"};

    @Override
    public Result<List<GeometryNode>, GenerationException> emit(List<ScopedNode> tree, InterpreterContext context) {
        try {
            Emission emission = new Emission(context);
            List<ScopedNode> roots = tree;
            ScopedNode root = findRoot(tree);
            if (root != null) {
                LOG.log(Level.FINE, "Root modifier found on {0}, emitting only that subtree", root.getType());
                roots = Collections.singletonList(root);
            }
            return Result.ok(emission.emitAll(roots));
        } catch (GenerationException e) {
            return Result.err(e);
        } catch (ScadException e) {
            return Result.err(new GenerationException(e.getMessage(), null, e));
        }
    }

    private static ScopedNode findRoot(List<ScopedNode> tree) {
        for (ScopedNode n : tree) {
            if (n.getModifier() == StatementModifier.ROOT) {
                return n;
            }
            ScopedNode nested = findRoot(n.getChildren());
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    /** 一次生成过程的状态 */
    private static final class Emission {
        private final InterpreterContext context;
        private final Map<String, Integer> counters = new LinkedHashMap<>();

        Emission(InterpreterContext context) {
            this.context = context;
        }

        List<GeometryNode> emitAll(List<ScopedNode> nodes) {
            List<GeometryNode> out = new ArrayList<>(nodes.size());
            for (ScopedNode n : nodes) {
                out.add(emitNode(n));
            }
            return out;
        }

        GeometryNode emitNode(ScopedNode scoped) {
            String type = scoped.getType();
            NodeCategory category = NodeCategory.of(type);
            Signature signature = BuiltinSignatures.lookup(type);
            if (!(scoped.getNode() instanceof CallNode) || !category.isGeometry() || signature == null) {
                throw new GenerationException("Unsupported node type: " + type, type);
            }
            CallNode call = (CallNode) scoped.getNode();
            String id = nextId(type);
            return PerformanceTracker.track(context.getTracker(), "geometry-" + id, type, () -> {
                VariableLookup vars = context.getScopes().lookup(scoped.getScope());
                Map<String, ScadValue> args = context.getBinder()
                        .bindBuiltinArguments(signature, call.getArguments(), vars);
                if (category == NodeCategory.PRIMITIVE) {
                    for (String special : RESOLUTION_VARIABLES) {
                        ScadValue inherited = vars.lookup(special);
                        if (!args.containsKey(special) && inherited != null) {
                            args.put(special, inherited);
                        }
                    }
                }
                PrimitiveValidator.normalize(type, args);
                Map<String, Object> geometry = new LinkedHashMap<>();
                for (Map.Entry<String, ScadValue> e : args.entrySet()) {
                    geometry.put(e.getKey(), e.getValue().toJavaValue());
                }
                String modifier = scoped.getModifier() != null ? scoped.getModifier().getLabel() : null;
                GeometryMetadata metadata = new GeometryMetadata(call, category.getLabel(),
                        scoped.getScope().getScopeId(), modifier);
                return new GeometryNode(id, type, geometry, metadata, emitAll(scoped.getChildren()));
            });
        }

        private String nextId(String type) {
            Integer n = counters.get(type);
            n = n == null ? 0 : n + 1;
            counters.put(type, n);
            return type + "_" + n;
        }
    }

    /**
     * 几何参数的规范化与尺寸校验
     */
    static final class PrimitiveValidator {

        private PrimitiveValidator() {
        }

        static void normalize(String type, Map<String, ScadValue> args) {
            switch (type) {
                case "cube":
                    requireSize(type, args, "size", 3);
                    break;
                case "square":
                    requireSize(type, args, "size", 2);
                    break;
                case "sphere":
                case "circle":
                    resolveRadius(type, args, "r", "d");
                    break;
                case "cylinder":
                    requireNonNegative(type, "h", args.get("h"));
                    ScadValue r = radius(type, args, "r", "d");
                    ScadValue r1 = firstOf(radius(type, args, "r1", "d1"), r, ScadNumber.ONE);
                    ScadValue r2 = firstOf(radius(type, args, "r2", "d2"), r, ScadNumber.ONE);
                    args.keySet().removeAll(Arrays.asList("r", "d", "d1", "d2"));
                    args.put("r1", r1);
                    args.put("r2", r2);
                    break;
                case "polygon":
                    requireVector(type, args, "points");
                    break;
                case "polyhedron":
                    requireVector(type, args, "points");
                    if (!args.containsKey("faces") && args.containsKey("triangles")) {
                        args.put("faces", args.remove("triangles"));
                    }
                    requireVector(type, args, "faces");
                    break;
                case "translate":
                case "mirror":
                    requireNumericVector(type, args, "v");
                    break;
                case "scale":
                    if (args.get("v").isNumber()) {
                        double s = args.get("v").asDouble();
                        args.put("v", ScadVector.ofNumbers(s, s, s));
                    }
                    requireNumericVector(type, args, "v");
                    break;
                case "linear_extrude":
                    requireNonNegative(type, "height", args.get("height"));
                    break;
                case "multmatrix":
                    requireVector(type, args, "m");
                    break;
                default:
                    break;
            }
        }

        private static void requireSize(String type, Map<String, ScadValue> args, String name, int dims) {
            ScadValue size = args.get(name);
            if (size.isNumber()) {
                requireNonNegative(type, name, size);
                double s = size.asDouble();
                double[] expanded = new double[dims];
                Arrays.fill(expanded, s);
                args.put(name, ScadVector.ofNumbers(expanded));
                return;
            }
            if (!size.isVector() || !((ScadVector) size).isNumeric() || ((ScadVector) size).size() != dims) {
                throw new GenerationException("Invalid parameter '" + name + "' for " + type + ": expected number or "
                        + dims + "-vector, got " + size, type);
            }
            for (ScadValue v : ((ScadVector) size).getElements()) {
                requireNonNegative(type, name, v);
            }
        }

        private static void resolveRadius(String type, Map<String, ScadValue> args, String r, String d) {
            ScadValue radius = radius(type, args, r, d);
            args.remove(d);
            args.put(r, radius != null ? radius : ScadNumber.ONE);
        }

        /** 直径优先于半径；两者都没有时返回 null */
        private static ScadValue radius(String type, Map<String, ScadValue> args, String r, String d) {
            ScadValue diameter = args.get(d);
            if (diameter != null && !diameter.isUndef()) {
                requireNonNegative(type, d, diameter);
                return ScadNumber.of(diameter.asDouble() / 2);
            }
            ScadValue radius = args.get(r);
            if (radius != null && !radius.isUndef()) {
                requireNonNegative(type, r, radius);
                return radius;
            }
            return null;
        }

        private static ScadValue firstOf(ScadValue... candidates) {
            for (ScadValue v : candidates) {
                if (v != null) return v;
            }
            return null;
        }

        private static void requireNonNegative(String type, String name, ScadValue value) {
            if (value == null || !value.isNumber()) {
                throw new GenerationException("Invalid parameter '" + name + "' for " + type
                        + ": expected number, got " + (value == null ? "nothing" : value.getTypeName()), type);
            }
            if (value.asDouble() < 0 || Double.isNaN(value.asDouble())) {
                throw new GenerationException("Invalid parameter '" + name + "' for " + type
                        + ": dimension must be non-negative, got " + value, type);
            }
        }

        private static void requireVector(String type, Map<String, ScadValue> args, String name) {
            ScadValue value = args.get(name);
            if (value == null || !value.isVector()) {
                throw new GenerationException("Invalid parameter '" + name + "' for " + type
                        + ": expected vector, got " + (value == null ? "nothing" : value.getTypeName()), type);
            }
        }

        private static void requireNumericVector(String type, Map<String, ScadValue> args, String name) {
            requireVector(type, args, name);
            if (!((ScadVector) args.get(name)).isNumeric()) {
                throw new GenerationException("Invalid parameter '" + name + "' for " + type
                        + ": expected numeric vector, got " + args.get(name), type);
            }
        }
    }
}
