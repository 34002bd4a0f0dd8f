package scadflow.runtime.perf;

/**
 * 操作前后的堆内存占用（字节）
 */
public final class MemoryUsage {
    private final long before;
    private final long after;

    public MemoryUsage(long before, long after) {
        this.before = before;
        this.after = after;
    }

    /** 当前 JVM 已用堆内存 */
    public static long currentUsed() {
        Runtime rt = Runtime.getRuntime();
        return rt.totalMemory() - rt.freeMemory();
    }

    public long getBefore() {
        return before;
    }

    public long getAfter() {
        return after;
    }

    public long getDelta() {
        return after - before;
    }

    @Override
    public String toString() {
        return "MemoryUsage{before=" + before + ", after=" + after + ", delta=" + getDelta() + "}";
    }
}
