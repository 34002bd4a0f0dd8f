package scadflow.runtime.perf;

import scadflow.runtime.ScadException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * 性能追踪器
 *
 * <p>记录每个命名操作的耗时与内存变化。已完成记录只追加不修改，
 * 汇总在查询时计算。实例不跨流水线运行共享，因此不做同步。</p>
 */
public final class PerformanceTracker {

    static final int SLOWEST_LIMIT = 5;

    private final Map<String, PendingOperation> pending = new HashMap<>();
    private final List<PerformanceRecord> records = new ArrayList<>();

    /**
     * 开始追踪
     *
     * @param operationName 操作名（同名重复开始会覆盖之前的起点）
     * @param subjectLabel  归属的模块名或节点类型
     */
    public void startTracking(String operationName, String subjectLabel) {
        pending.put(operationName, new PendingOperation(subjectLabel, System.nanoTime(), MemoryUsage.currentUsed()));
    }

    /**
     * 结束追踪并生成记录
     *
     * @throws ScadException 该操作未开始
     */
    public PerformanceRecord endTracking(String operationName) {
        PendingOperation op = pending.remove(operationName);
        if (op == null) {
            throw new ScadException("Operation " + operationName + " was not started");
        }
        double elapsedMs = (System.nanoTime() - op.startNanos) / 1_000_000.0;
        PerformanceRecord record = new PerformanceRecord(operationName, op.subject, elapsedMs,
                new MemoryUsage(op.memoryBefore, MemoryUsage.currentUsed()));
        records.add(record);
        return record;
    }

    public boolean isTracking(String operationName) {
        return pending.containsKey(operationName);
    }

    /** 已完成记录（只读视图） */
    public List<PerformanceRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public PerformanceMetrics getPerformanceMetrics() {
        int total = records.size();
        double totalTime = 0.0;
        long totalMemory = 0L;
        Map<String, Integer> bySubject = new TreeMap<>();
        for (PerformanceRecord r : records) {
            totalTime += r.getProcessingTimeMs();
            totalMemory += Math.abs(r.getMemoryUsage().getDelta());
            bySubject.merge(r.getSubjectLabel(), 1, Integer::sum);
        }
        List<PerformanceRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingDouble(PerformanceRecord::getProcessingTimeMs).reversed());
        List<PerformanceRecord> slowest = new ArrayList<>(sorted.subList(0, Math.min(SLOWEST_LIMIT, sorted.size())));
        double average = total > 0 ? totalTime / total : 0.0;
        return new PerformanceMetrics(total, average, totalTime, totalMemory, bySubject, slowest);
    }

    public void clear() {
        pending.clear();
        records.clear();
    }

    /**
     * 追踪一段计算；tracker 为 null 时直接执行
     */
    public static <T> T track(PerformanceTracker tracker, String operationName, String subjectLabel,
                              Supplier<T> action) {
        if (tracker == null) {
            return action.get();
        }
        tracker.startTracking(operationName, subjectLabel);
        try {
            return action.get();
        } finally {
            tracker.endTracking(operationName);
        }
    }

    private static final class PendingOperation {
        final String subject;
        final long startNanos;
        final long memoryBefore;

        PendingOperation(String subject, long startNanos, long memoryBefore) {
            this.subject = subject;
            this.startNanos = startNanos;
            this.memoryBefore = memoryBefore;
        }
    }
}
