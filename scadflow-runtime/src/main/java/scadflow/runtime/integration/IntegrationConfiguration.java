package scadflow.runtime.integration;

import scadflow.runtime.ast.PipelineConfiguration;
import scadflow.runtime.interpreter.InterpreterContext;
import scadflow.runtime.module.ModulePipelineConfiguration;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * 集成流水线配置（不可变）
 *
 * <p>也可从 Properties 加载，键名为 {@code scadflow.<选项名>}。</p>
 */
public final class IntegrationConfiguration {

    public static final String PROPERTY_PREFIX = "scadflow.";
    public static final long DEFAULT_MAX_PROCESSING_TIME = 30_000L;

    private final boolean enableModuleProcessing;
    private final boolean enableLoopProcessing;
    private final boolean enableConditionalProcessing;
    private final boolean enablePerformanceTracking;
    private final long maxProcessingTime;
    private final boolean enableCaching;
    private final boolean enableValidation;
    private final boolean enableOptimization;
    private final int maxRecursionDepth;
    private final long maxLoopIterations;
    private final boolean lenientChildProcessing;

    private IntegrationConfiguration(Builder b) {
        this.enableModuleProcessing = b.enableModuleProcessing;
        this.enableLoopProcessing = b.enableLoopProcessing;
        this.enableConditionalProcessing = b.enableConditionalProcessing;
        this.enablePerformanceTracking = b.enablePerformanceTracking;
        this.maxProcessingTime = b.maxProcessingTime;
        this.enableCaching = b.enableCaching;
        this.enableValidation = b.enableValidation;
        this.enableOptimization = b.enableOptimization;
        this.maxRecursionDepth = b.maxRecursionDepth;
        this.maxLoopIterations = b.maxLoopIterations;
        this.lenientChildProcessing = b.lenientChildProcessing;
    }

    public static IntegrationConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 从 Properties 加载，缺省的键取默认值
     *
     * @throws IllegalArgumentException 数值无法解析
     */
    public static IntegrationConfiguration fromProperties(Properties props) {
        Builder b = builder();
        b.enableModuleProcessing(bool(props, "enableModuleProcessing", b.enableModuleProcessing));
        b.enableLoopProcessing(bool(props, "enableLoopProcessing", b.enableLoopProcessing));
        b.enableConditionalProcessing(bool(props, "enableConditionalProcessing", b.enableConditionalProcessing));
        b.enablePerformanceTracking(bool(props, "enablePerformanceTracking", b.enablePerformanceTracking));
        b.maxProcessingTime(number(props, "maxProcessingTime", b.maxProcessingTime));
        b.enableCaching(bool(props, "enableCaching", b.enableCaching));
        b.enableValidation(bool(props, "enableValidation", b.enableValidation));
        b.enableOptimization(bool(props, "enableOptimization", b.enableOptimization));
        b.maxRecursionDepth((int) number(props, "maxRecursionDepth", b.maxRecursionDepth));
        b.maxLoopIterations(number(props, "maxLoopIterations", b.maxLoopIterations));
        b.lenientChildProcessing(bool(props, "lenientChildProcessing", b.lenientChildProcessing));
        return b.build();
    }

    private static boolean bool(Properties props, String key, boolean fallback) {
        String value = props.getProperty(PROPERTY_PREFIX + key);
        return value == null ? fallback : Boolean.parseBoolean(value.trim());
    }

    private static long number(Properties props, String key, long fallback) {
        String value = props.getProperty(PROPERTY_PREFIX + key);
        if (value == null) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PROPERTY_PREFIX + key + ": " + value, e);
        }
    }

    /**
     * @return 配置问题列表，为空表示合法
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (maxProcessingTime <= 0) {
            problems.add("maxProcessingTime must be positive, got " + maxProcessingTime);
        }
        if (maxRecursionDepth <= 0) {
            problems.add("maxRecursionDepth must be positive, got " + maxRecursionDepth);
        }
        if (maxLoopIterations <= 0) {
            problems.add("maxLoopIterations must be positive, got " + maxLoopIterations);
        }
        return problems;
    }

    public PipelineConfiguration toPipelineConfiguration() {
        return PipelineConfiguration.builder()
                .enableOptimization(enableOptimization)
                .enableCaching(enableCaching)
                .enableValidation(enableValidation)
                .lenientChildProcessing(lenientChildProcessing)
                .build();
    }

    public ModulePipelineConfiguration toModuleConfiguration() {
        return new ModulePipelineConfiguration(maxRecursionDepth, enableValidation);
    }

    public boolean isEnableModuleProcessing() {
        return enableModuleProcessing;
    }

    public boolean isEnableLoopProcessing() {
        return enableLoopProcessing;
    }

    public boolean isEnableConditionalProcessing() {
        return enableConditionalProcessing;
    }

    public boolean isEnablePerformanceTracking() {
        return enablePerformanceTracking;
    }

    /** 软性时间预算（毫秒），超出只记录警告 */
    public long getMaxProcessingTime() {
        return maxProcessingTime;
    }

    public boolean isEnableCaching() {
        return enableCaching;
    }

    public boolean isEnableValidation() {
        return enableValidation;
    }

    public boolean isEnableOptimization() {
        return enableOptimization;
    }

    public int getMaxRecursionDepth() {
        return maxRecursionDepth;
    }

    public long getMaxLoopIterations() {
        return maxLoopIterations;
    }

    public boolean isLenientChildProcessing() {
        return lenientChildProcessing;
    }

    public Builder toBuilder() {
        return builder()
                .enableModuleProcessing(enableModuleProcessing)
                .enableLoopProcessing(enableLoopProcessing)
                .enableConditionalProcessing(enableConditionalProcessing)
                .enablePerformanceTracking(enablePerformanceTracking)
                .maxProcessingTime(maxProcessingTime)
                .enableCaching(enableCaching)
                .enableValidation(enableValidation)
                .enableOptimization(enableOptimization)
                .maxRecursionDepth(maxRecursionDepth)
                .maxLoopIterations(maxLoopIterations)
                .lenientChildProcessing(lenientChildProcessing);
    }

    @Override
    public String toString() {
        return "IntegrationConfiguration{modules=" + enableModuleProcessing
                + ", loops=" + enableLoopProcessing
                + ", conditionals=" + enableConditionalProcessing
                + ", tracking=" + enablePerformanceTracking
                + ", caching=" + enableCaching
                + ", maxProcessingTime=" + maxProcessingTime
                + ", maxRecursionDepth=" + maxRecursionDepth
                + ", maxLoopIterations=" + maxLoopIterations + "}";
    }

    public static final class Builder {
        private boolean enableModuleProcessing = true;
        private boolean enableLoopProcessing = true;
        private boolean enableConditionalProcessing = true;
        private boolean enablePerformanceTracking = true;
        private long maxProcessingTime = DEFAULT_MAX_PROCESSING_TIME;
        private boolean enableCaching = true;
        private boolean enableValidation = true;
        private boolean enableOptimization = true;
        private int maxRecursionDepth = ModulePipelineConfiguration.DEFAULT_MAX_RECURSION_DEPTH;
        private long maxLoopIterations = InterpreterContext.DEFAULT_MAX_LOOP_ITERATIONS;
        private boolean lenientChildProcessing = true;

        private Builder() {
        }

        public Builder enableModuleProcessing(boolean v) {
            this.enableModuleProcessing = v;
            return this;
        }

        public Builder enableLoopProcessing(boolean v) {
            this.enableLoopProcessing = v;
            return this;
        }

        public Builder enableConditionalProcessing(boolean v) {
            this.enableConditionalProcessing = v;
            return this;
        }

        public Builder enablePerformanceTracking(boolean v) {
            this.enablePerformanceTracking = v;
            return this;
        }

        public Builder maxProcessingTime(long ms) {
            this.maxProcessingTime = ms;
            return this;
        }

        public Builder enableCaching(boolean v) {
            this.enableCaching = v;
            return this;
        }

        public Builder enableValidation(boolean v) {
            this.enableValidation = v;
            return this;
        }

        public Builder enableOptimization(boolean v) {
            this.enableOptimization = v;
            return this;
        }

        public Builder maxRecursionDepth(int depth) {
            this.maxRecursionDepth = depth;
            return this;
        }

        public Builder maxLoopIterations(long iterations) {
            this.maxLoopIterations = iterations;
            return this;
        }

        public Builder lenientChildProcessing(boolean v) {
            this.lenientChildProcessing = v;
            return this;
        }

        public IntegrationConfiguration build() {
            return new IntegrationConfiguration(this);
        }
    }
}
