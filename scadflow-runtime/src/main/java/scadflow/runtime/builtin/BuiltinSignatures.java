package scadflow.runtime.builtin;

import scadflow.runtime.ScadBoolean;
import scadflow.runtime.ScadNumber;
import scadflow.runtime.ScadString;
import scadflow.runtime.ScadVector;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 内置几何调用的签名表
 */
public final class BuiltinSignatures {

    private static final Map<String, Signature> SIGNATURES;

    static {
        Map<String, Signature> map = new HashMap<>();

        // 基本体
        register(map, Signature.builder("cube")
                .positional("size", "center")
                .defaultValue("size", ScadNumber.ONE)
                .defaultValue("center", ScadBoolean.FALSE));
        register(map, Signature.builder("sphere")
                .positional("r")
                .named("d")
                .defaultValue("r", ScadNumber.ONE));
        register(map, Signature.builder("cylinder")
                .positional("h", "r1", "r2", "center")
                .named("r", "d", "d1", "d2")
                .defaultValue("h", ScadNumber.ONE)
                .defaultValue("center", ScadBoolean.FALSE));
        register(map, Signature.builder("circle")
                .positional("r")
                .named("d")
                .defaultValue("r", ScadNumber.ONE));
        register(map, Signature.builder("square")
                .positional("size", "center")
                .defaultValue("size", ScadNumber.ONE)
                .defaultValue("center", ScadBoolean.FALSE));
        register(map, Signature.builder("polygon")
                .positional("points", "paths", "convexity")
                .defaultValue("convexity", ScadNumber.ONE));
        register(map, Signature.builder("polyhedron")
                .positional("points", "faces", "convexity")
                .named("triangles")
                .defaultValue("convexity", ScadNumber.ONE));
        register(map, Signature.builder("text")
                .positional("text", "size", "font", "halign", "valign", "spacing", "direction", "language", "script")
                .defaultValue("text", ScadString.EMPTY)
                .defaultValue("size", ScadNumber.of(10))
                .defaultValue("halign", ScadString.of("left"))
                .defaultValue("valign", ScadString.of("baseline"))
                .defaultValue("spacing", ScadNumber.ONE)
                .defaultValue("direction", ScadString.of("ltr"))
                .defaultValue("language", ScadString.of("en"))
                .defaultValue("script", ScadString.of("latin")));

        // 变换
        register(map, Signature.builder("translate")
                .positional("v")
                .defaultValue("v", ScadVector.ofNumbers(0, 0, 0)));
        register(map, Signature.builder("rotate")
                .positional("a", "v")
                .defaultValue("a", ScadNumber.ZERO));
        register(map, Signature.builder("scale")
                .positional("v")
                .defaultValue("v", ScadVector.ofNumbers(1, 1, 1)));
        register(map, Signature.builder("mirror")
                .positional("v")
                .defaultValue("v", ScadVector.ofNumbers(1, 0, 0)));
        register(map, Signature.builder("multmatrix")
                .positional("m"));
        register(map, Signature.builder("color")
                .positional("c", "alpha")
                .defaultValue("alpha", ScadNumber.ONE));
        register(map, Signature.builder("resize")
                .positional("newsize", "auto")
                .defaultValue("auto", ScadBoolean.FALSE));
        register(map, Signature.builder("offset")
                .positional("r")
                .named("delta", "chamfer")
                .defaultValue("chamfer", ScadBoolean.FALSE));
        register(map, Signature.builder("linear_extrude")
                .positional("height", "center", "convexity", "twist", "slices", "scale")
                .named("v")
                .defaultValue("height", ScadNumber.of(100))
                .defaultValue("center", ScadBoolean.FALSE)
                .defaultValue("twist", ScadNumber.ZERO)
                .defaultValue("scale", ScadNumber.ONE));
        register(map, Signature.builder("rotate_extrude")
                .positional("angle", "convexity")
                .defaultValue("angle", ScadNumber.of(360)));
        register(map, Signature.builder("render")
                .positional("convexity")
                .defaultValue("convexity", ScadNumber.ONE));

        // 布尔运算
        register(map, Signature.builder("union"));
        register(map, Signature.builder("difference"));
        register(map, Signature.builder("intersection"));
        register(map, Signature.builder("hull"));
        register(map, Signature.builder("minkowski").positional("convexity"));

        // 模块体内的 children(index)
        register(map, Signature.builder("children").positional("index"));

        SIGNATURES = Collections.unmodifiableMap(map);
    }

    private BuiltinSignatures() {
    }

    private static void register(Map<String, Signature> map, Signature.Builder builder) {
        Signature sig = builder.build();
        map.put(sig.getName(), sig);
    }

    /** 查找签名，未登记返回 null */
    public static Signature lookup(String name) {
        return SIGNATURES.get(name);
    }

    public static boolean contains(String name) {
        return SIGNATURES.containsKey(name);
    }
}
