package scadflow.runtime.ast;

import com.scadflow.compiler.ast.AstNode;
import com.scadflow.compiler.ast.NodeCategory;
import com.scadflow.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分类后的节点
 */
public final class ProcessedNode {
    private final AstNode originalNode;
    private final NodeCategory nodeType;
    private final Map<String, Expression> parameters;
    private final List<ProcessedNode> children;
    private final NodeProcessingMetadata processingMetadata;

    public ProcessedNode(AstNode originalNode, NodeCategory nodeType, Map<String, Expression> parameters,
                         List<ProcessedNode> children, NodeProcessingMetadata processingMetadata) {
        this.originalNode = originalNode;
        this.nodeType = nodeType;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.children = Collections.unmodifiableList(children);
        this.processingMetadata = processingMetadata;
    }

    public AstNode getOriginalNode() {
        return originalNode;
    }

    /** 节点类别 */
    public NodeCategory getNodeType() {
        return nodeType;
    }

    public Map<String, Expression> getParameters() {
        return parameters;
    }

    public List<ProcessedNode> getChildren() {
        return children;
    }

    public NodeProcessingMetadata getProcessingMetadata() {
        return processingMetadata;
    }

    /** 整棵子树中被跳过的子节点数 */
    public int countSkippedChildren() {
        int count = processingMetadata.getSkippedChildren().size();
        for (ProcessedNode child : children) {
            count += child.countSkippedChildren();
        }
        return count;
    }
}
