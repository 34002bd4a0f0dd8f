package scadflow.runtime.ast;

import java.util.Collections;
import java.util.List;

/**
 * 单个节点的处理元数据
 */
public final class NodeProcessingMetadata {
    private final double processingTimeMs;
    private final long memoryDelta;
    private final List<SkippedChild> skippedChildren;

    public NodeProcessingMetadata(double processingTimeMs, long memoryDelta, List<SkippedChild> skippedChildren) {
        this.processingTimeMs = processingTimeMs;
        this.memoryDelta = memoryDelta;
        this.skippedChildren = Collections.unmodifiableList(skippedChildren);
    }

    public double getProcessingTimeMs() {
        return processingTimeMs;
    }

    public long getMemoryDelta() {
        return memoryDelta;
    }

    /** 本节点直接跳过的子节点 */
    public List<SkippedChild> getSkippedChildren() {
        return skippedChildren;
    }
}
