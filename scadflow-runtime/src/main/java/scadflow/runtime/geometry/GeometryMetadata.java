package scadflow.runtime.geometry;

import com.scadflow.compiler.ast.AstNode;

/**
 * 几何节点的溯源信息
 */
public final class GeometryMetadata {
    private final AstNode originatingNode;
    private final String category;
    private final String scopeId;
    private final String modifier;

    public GeometryMetadata(AstNode originatingNode, String category, String scopeId, String modifier) {
        this.originatingNode = originatingNode;
        this.category = category;
        this.scopeId = scopeId;
        this.modifier = modifier;
    }

    public AstNode getOriginatingNode() {
        return originatingNode;
    }

    public String getCategory() {
        return category;
    }

    public String getScopeId() {
        return scopeId;
    }

    /** 修饰符标签（root/highlight/background），无修饰符时为 null */
    public String getModifier() {
        return modifier;
    }
}
