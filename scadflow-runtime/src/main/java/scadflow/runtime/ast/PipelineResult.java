package scadflow.runtime.ast;

import java.util.Collections;
import java.util.List;

/**
 * AST 流水线处理结果
 */
public final class PipelineResult {
    private final List<ProcessedNode> processedNodes;
    private final List<String> stagesExecuted;
    private final double processingTimeMs;
    private final double nodeProcessingTimeMs;
    private final long memoryDelta;
    private final boolean budgetExceeded;

    public PipelineResult(List<ProcessedNode> processedNodes, List<String> stagesExecuted,
                          double processingTimeMs, double nodeProcessingTimeMs,
                          long memoryDelta, boolean budgetExceeded) {
        this.processedNodes = Collections.unmodifiableList(processedNodes);
        this.stagesExecuted = Collections.unmodifiableList(stagesExecuted);
        this.processingTimeMs = processingTimeMs;
        this.nodeProcessingTimeMs = nodeProcessingTimeMs;
        this.memoryDelta = memoryDelta;
        this.budgetExceeded = budgetExceeded;
    }

    /** 与输入顺序一致 */
    public List<ProcessedNode> getProcessedNodes() {
        return processedNodes;
    }

    /** 单节点处理时的结果节点 */
    public ProcessedNode getProcessedNode() {
        return processedNodes.isEmpty() ? null : processedNodes.get(0);
    }

    /** 实际执行过的阶段名 */
    public List<String> getStagesExecuted() {
        return stagesExecuted;
    }

    /** 外层计时 */
    public double getProcessingTimeMs() {
        return processingTimeMs;
    }

    /** 各节点自身计时之和 */
    public double getNodeProcessingTimeMs() {
        return nodeProcessingTimeMs;
    }

    public long getMemoryDelta() {
        return memoryDelta;
    }

    public boolean isBudgetExceeded() {
        return budgetExceeded;
    }
}
