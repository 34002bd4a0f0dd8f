package scadflow.runtime.geometry;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 流水线输出的几何节点
 *
 * <p>geometry 为绑定后的参数，已转换为普通 Java 值（Double、String、Boolean、List、Map 或 null）。
 * 变换与 CSG 节点带有其子几何节点。</p>
 */
public final class GeometryNode {
    private final String id;
    private final String type;
    private final Map<String, Object> geometry;
    private final GeometryMetadata metadata;
    private final List<GeometryNode> children;

    public GeometryNode(String id, String type, Map<String, Object> geometry, GeometryMetadata metadata,
                        List<GeometryNode> children) {
        this.id = id;
        this.type = type;
        this.geometry = Collections.unmodifiableMap(geometry);
        this.metadata = metadata;
        this.children = Collections.unmodifiableList(children);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getGeometry() {
        return geometry;
    }

    public GeometryMetadata getMetadata() {
        return metadata;
    }

    public List<GeometryNode> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return "GeometryNode{" + id + ", " + geometry + ", children=" + children.size() + "}";
    }
}
