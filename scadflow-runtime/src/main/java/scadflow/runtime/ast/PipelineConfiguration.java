package scadflow.runtime.ast;

/**
 * AST 处理流水线配置（不可变）
 */
public final class PipelineConfiguration {

    public static final long DEFAULT_MAX_PROCESSING_TIME = 5000L;
    public static final long DEFAULT_CACHE_SIZE = 10_000L;

    private final boolean enableOptimization;
    private final boolean enableCaching;
    private final long maxProcessingTime;
    private final boolean enableValidation;
    private final boolean lenientChildProcessing;
    private final long cacheSize;

    private PipelineConfiguration(Builder builder) {
        this.enableOptimization = builder.enableOptimization;
        this.enableCaching = builder.enableCaching;
        this.maxProcessingTime = builder.maxProcessingTime;
        this.enableValidation = builder.enableValidation;
        this.lenientChildProcessing = builder.lenientChildProcessing;
        this.cacheSize = builder.cacheSize;
    }

    public static PipelineConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEnableOptimization() {
        return enableOptimization;
    }

    public boolean isEnableCaching() {
        return enableCaching;
    }

    /** 软性时间预算（毫秒），超出只记录警告 */
    public long getMaxProcessingTime() {
        return maxProcessingTime;
    }

    public boolean isEnableValidation() {
        return enableValidation;
    }

    public boolean isLenientChildProcessing() {
        return lenientChildProcessing;
    }

    public long getCacheSize() {
        return cacheSize;
    }

    public Builder toBuilder() {
        return new Builder()
                .enableOptimization(enableOptimization)
                .enableCaching(enableCaching)
                .maxProcessingTime(maxProcessingTime)
                .enableValidation(enableValidation)
                .lenientChildProcessing(lenientChildProcessing)
                .cacheSize(cacheSize);
    }

    public static final class Builder {
        private boolean enableOptimization = true;
        private boolean enableCaching = true;
        private long maxProcessingTime = DEFAULT_MAX_PROCESSING_TIME;
        private boolean enableValidation = true;
        private boolean lenientChildProcessing = true;
        private long cacheSize = DEFAULT_CACHE_SIZE;

        private Builder() {
        }

        public Builder enableOptimization(boolean value) {
            this.enableOptimization = value;
            return this;
        }

        public Builder enableCaching(boolean value) {
            this.enableCaching = value;
            return this;
        }

        public Builder maxProcessingTime(long value) {
            this.maxProcessingTime = value;
            return this;
        }

        public Builder enableValidation(boolean value) {
            this.enableValidation = value;
            return this;
        }

        public Builder lenientChildProcessing(boolean value) {
            this.lenientChildProcessing = value;
            return this;
        }

        public Builder cacheSize(long value) {
            this.cacheSize = value;
            return this;
        }

        public PipelineConfiguration build() {
            return new PipelineConfiguration(this);
        }
    }
}
