package scadflow.runtime.ast;

import com.scadflow.compiler.ast.NodeCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * AST 结构统计
 */
public final class StructureAnalysis {
    private final int nodeCount;
    private final int maxDepth;
    private final Set<String> nodeTypes;
    private final Map<NodeCategory, Integer> categoryCounts;
    private final double nodeComplexity;
    private final double depthComplexity;

    public StructureAnalysis(int nodeCount, int maxDepth, Set<String> nodeTypes,
                             Map<NodeCategory, Integer> categoryCounts,
                             double nodeComplexity, double depthComplexity) {
        this.nodeCount = nodeCount;
        this.maxDepth = maxDepth;
        this.nodeTypes = Collections.unmodifiableSet(new LinkedHashSet<>(nodeTypes));
        Map<NodeCategory, Integer> counts = new EnumMap<>(NodeCategory.class);
        counts.putAll(categoryCounts);
        this.categoryCounts = Collections.unmodifiableMap(counts);
        this.nodeComplexity = nodeComplexity;
        this.depthComplexity = depthComplexity;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    /** 根节点深度为 1 */
    public int getMaxDepth() {
        return maxDepth;
    }

    /** 出现过的节点类型（首次出现顺序） */
    public Set<String> getNodeTypes() {
        return nodeTypes;
    }

    public int countOf(NodeCategory category) {
        Integer n = categoryCounts.get(category);
        return n != null ? n : 0;
    }

    public Map<NodeCategory, Integer> getCategoryCounts() {
        return categoryCounts;
    }

    public double getNodeComplexity() {
        return nodeComplexity;
    }

    public double getDepthComplexity() {
        return depthComplexity;
    }

    public double getComplexity() {
        return nodeComplexity + depthComplexity;
    }
}
