package scadflow.runtime.integration;

import scadflow.runtime.perf.MemoryUsage;
import scadflow.runtime.perf.PerformanceMetrics;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 一次运行的元数据
 */
public final class ProcessingMetadata {
    private final double processingTimeMs;
    private final MemoryUsage memoryUsage;
    private final List<String> stagesCompleted;
    private final Map<String, Double> stageTiming;
    private final PerformanceMetrics performanceMetrics;
    private final List<String> echoMessages;

    public ProcessingMetadata(double processingTimeMs, MemoryUsage memoryUsage, List<String> stagesCompleted,
                              Map<String, Double> stageTiming, PerformanceMetrics performanceMetrics,
                              List<String> echoMessages) {
        this.processingTimeMs = processingTimeMs;
        this.memoryUsage = memoryUsage;
        this.stagesCompleted = Collections.unmodifiableList(stagesCompleted);
        this.stageTiming = Collections.unmodifiableMap(stageTiming);
        this.performanceMetrics = performanceMetrics;
        this.echoMessages = Collections.unmodifiableList(echoMessages);
    }

    public double getProcessingTimeMs() {
        return processingTimeMs;
    }

    public MemoryUsage getMemoryUsage() {
        return memoryUsage;
    }

    /** 执行过的阶段，每个只出现一次，按执行顺序 */
    public List<String> getStagesCompleted() {
        return stagesCompleted;
    }

    /** 各阶段耗时（毫秒），多轮展开的时间累加 */
    public Map<String, Double> getStageTiming() {
        return stageTiming;
    }

    /** 未启用性能追踪时为 null */
    public PerformanceMetrics getPerformanceMetrics() {
        return performanceMetrics;
    }

    public List<String> getEchoMessages() {
        return echoMessages;
    }
}
