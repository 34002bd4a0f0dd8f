package scadflow.runtime.perf;

/**
 * 一次已完成操作的计时记录（创建后不可变）
 */
public final class PerformanceRecord {
    private final String operationName;
    private final String subjectLabel;
    private final double processingTimeMs;
    private final MemoryUsage memoryUsage;

    public PerformanceRecord(String operationName, String subjectLabel,
                             double processingTimeMs, MemoryUsage memoryUsage) {
        this.operationName = operationName;
        this.subjectLabel = subjectLabel;
        this.processingTimeMs = processingTimeMs;
        this.memoryUsage = memoryUsage;
    }

    public String getOperationName() {
        return operationName;
    }

    /** 模块名或节点类型 */
    public String getSubjectLabel() {
        return subjectLabel;
    }

    public double getProcessingTimeMs() {
        return processingTimeMs;
    }

    public MemoryUsage getMemoryUsage() {
        return memoryUsage;
    }

    @Override
    public String toString() {
        return String.format("%s[%s] %.3fms", operationName, subjectLabel, processingTimeMs);
    }
}
