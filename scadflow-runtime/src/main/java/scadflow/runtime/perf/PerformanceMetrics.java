package scadflow.runtime.perf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 性能汇总（按需从记录列表计算）
 */
public final class PerformanceMetrics {
    private final int totalOperations;
    private final double averageProcessingTime;
    private final double totalProcessingTime;
    private final long totalMemoryUsage;
    private final Map<String, Integer> operationsBySubject;
    private final List<PerformanceRecord> slowestOperations;

    public PerformanceMetrics(int totalOperations, double averageProcessingTime, double totalProcessingTime,
                              long totalMemoryUsage, Map<String, Integer> operationsBySubject,
                              List<PerformanceRecord> slowestOperations) {
        this.totalOperations = totalOperations;
        this.averageProcessingTime = averageProcessingTime;
        this.totalProcessingTime = totalProcessingTime;
        this.totalMemoryUsage = totalMemoryUsage;
        this.operationsBySubject = Collections.unmodifiableMap(new LinkedHashMap<>(operationsBySubject));
        this.slowestOperations = Collections.unmodifiableList(slowestOperations);
    }

    public int getTotalOperations() {
        return totalOperations;
    }

    public double getAverageProcessingTime() {
        return averageProcessingTime;
    }

    public double getTotalProcessingTime() {
        return totalProcessingTime;
    }

    /** 各操作内存变化绝对值之和 */
    public long getTotalMemoryUsage() {
        return totalMemoryUsage;
    }

    public Map<String, Integer> getOperationsBySubject() {
        return operationsBySubject;
    }

    /** 最慢的至多 5 个操作，耗时降序 */
    public List<PerformanceRecord> getSlowestOperations() {
        return slowestOperations;
    }

    @Override
    public String toString() {
        return String.format("operations=%d, avg=%.3fms, total=%.3fms, memory=%d bytes, bySubject=%s",
                totalOperations, averageProcessingTime, totalProcessingTime, totalMemoryUsage, operationsBySubject);
    }
}
