package com.scadflow.compiler.ast;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 节点语义类别
 *
 * <p>由节点 type 名经静态成员表计算得出，不存储在节点上。
 * 未登记的类型名映射为 {@link #UNKNOWN}，调用方必须显式处理。</p>
 */
public enum NodeCategory {
    PRIMITIVE("primitive"),
    TRANSFORMATION("transformation"),
    CSG_OPERATION("csg_operation"),
    CONTROL_FLOW("control_flow"),
    UNKNOWN("unknown");

    private static final Map<String, NodeCategory> TABLE;

    static {
        Map<String, NodeCategory> map = new HashMap<>();

        // 基本体
        for (String t : new String[]{"cube", "sphere", "cylinder", "circle", "square",
                "polygon", "polyhedron", "text"}) {
            map.put(t, PRIMITIVE);
        }

        // 变换（含拉伸类）
        for (String t : new String[]{"translate", "rotate", "scale", "mirror", "multmatrix", "color",
                "resize", "offset", "linear_extrude", "rotate_extrude", "render"}) {
            map.put(t, TRANSFORMATION);
        }

        // 布尔运算
        for (String t : new String[]{"union", "difference", "intersection", "hull", "minkowski"}) {
            map.put(t, CSG_OPERATION);
        }

        // 控制流：关键字形式与解析器产生的语句节点类型
        for (String t : new String[]{"for", "if", "let", "each", "module", "function",
                "if_statement", "for_loop", "let_statement", "module_definition",
                "module_instantiation", "function_definition", "assignment", "children", "echo"}) {
            map.put(t, CONTROL_FLOW);
        }

        TABLE = Collections.unmodifiableMap(map);
    }

    private final String label;

    NodeCategory(String label) {
        this.label = label;
    }

    /** 输出用的类别名（primitive / csg_operation ...） */
    public String getLabel() {
        return label;
    }

    /**
     * 类型名到类别的全映射
     *
     * @param type 节点类型名，可为 null
     * @return 类别，未登记返回 UNKNOWN
     */
    public static NodeCategory of(String type) {
        if (type == null) return UNKNOWN;
        NodeCategory category = TABLE.get(type);
        return category != null ? category : UNKNOWN;
    }

    /** 是否为产生几何的内置调用（基本体、变换、布尔运算） */
    public boolean isGeometry() {
        return this == PRIMITIVE || this == TRANSFORMATION || this == CSG_OPERATION;
    }

    /** 内置几何调用名 */
    public static boolean isBuiltinGeometry(String name) {
        return of(name).isGeometry();
    }

    /** 所有已登记的类型名 */
    public static Set<String> knownTypes() {
        return TABLE.keySet();
    }

    @Override
    public String toString() {
        return label;
    }
}
