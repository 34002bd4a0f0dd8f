package scadflow.runtime.ast;

import com.scadflow.compiler.ast.AstNode;

/**
 * 宽松模式下被跳过的子节点及原因
 */
public final class SkippedChild {
    private final AstNode node;
    private final String reason;

    public SkippedChild(AstNode node, String reason) {
        this.node = node;
        this.reason = reason;
    }

    public AstNode getNode() {
        return node;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return (node != null ? node.getType() : "null") + ": " + reason;
    }
}
