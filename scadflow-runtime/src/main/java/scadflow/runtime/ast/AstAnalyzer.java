package scadflow.runtime.ast;

import com.scadflow.compiler.ast.AstNode;
import com.scadflow.compiler.ast.NodeCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * AST 结构分析与查找工具
 *
 * <p>遍历覆盖子节点以及分支体、循环体、模块体。</p>
 */
public final class AstAnalyzer {

    private AstAnalyzer() {
    }

    public static StructureAnalysis analyzeStructure(AstNode root) {
        return analyzeStructure(Collections.singletonList(root));
    }

    /**
     * 统计节点数、最大深度、类型集合、类别计数与复杂度
     *
     * <p>复杂度：每个节点 1，布尔运算额外 2，控制流额外 3，变换额外 1；
     * 深度复杂度为最大深度的一半。</p>
     */
    public static StructureAnalysis analyzeStructure(List<? extends AstNode> roots) {
        final int[] count = {0};
        final int[] maxDepth = {0};
        final double[] complexity = {0.0};
        final Set<String> types = new LinkedHashSet<>();
        final Map<NodeCategory, Integer> categories = new EnumMap<>(NodeCategory.class);

        traverseDepthFirst(roots, (node, depth) -> {
            count[0]++;
            maxDepth[0] = Math.max(maxDepth[0], depth);
            types.add(node.getType());
            NodeCategory category = NodeCategory.of(node.getType());
            categories.merge(category, 1, Integer::sum);
            complexity[0] += 1;
            switch (category) {
                case CSG_OPERATION:
                    complexity[0] += 2;
                    break;
                case CONTROL_FLOW:
                    complexity[0] += 3;
                    break;
                case TRANSFORMATION:
                    complexity[0] += 1;
                    break;
                default:
                    break;
            }
        });

        return new StructureAnalysis(count[0], maxDepth[0], types, categories,
                complexity[0], maxDepth[0] * 0.5);
    }

    public static List<AstNode> findNodesByType(AstNode root, String type) {
        return findNodesByPredicate(root, node -> type.equals(node.getType()));
    }

    public static List<AstNode> findNodesByCategory(AstNode root, NodeCategory category) {
        return findNodesByPredicate(root, node -> NodeCategory.of(node.getType()) == category);
    }

    public static List<AstNode> findNodesByPredicate(AstNode root, Predicate<AstNode> predicate) {
        List<AstNode> found = new ArrayList<>();
        traverseDepthFirst(Collections.singletonList(root), (node, depth) -> {
            if (predicate.test(node)) {
                found.add(node);
            }
        });
        return found;
    }

    /**
     * 先序深度优先遍历，depth 从 1 开始
     */
    public static void traverseDepthFirst(List<? extends AstNode> roots, BiConsumer<AstNode, Integer> visitor) {
        for (AstNode root : roots) {
            visit(root, 1, visitor);
        }
    }

    private static void visit(AstNode node, int depth, BiConsumer<AstNode, Integer> visitor) {
        if (node == null) return;
        visitor.accept(node, depth);
        for (AstNode nested : node.getNestedNodes()) {
            visit(nested, depth + 1, visitor);
        }
    }
}
