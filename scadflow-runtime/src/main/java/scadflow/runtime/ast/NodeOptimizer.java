package scadflow.runtime.ast;

/**
 * optimization 阶段的节点变换
 */
@FunctionalInterface
public interface NodeOptimizer {

    ProcessedNode optimize(ProcessedNode node);
}
