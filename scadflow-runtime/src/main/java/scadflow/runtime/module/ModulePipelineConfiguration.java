package scadflow.runtime.module;

/**
 * 模块处理配置（不可变）
 */
public final class ModulePipelineConfiguration {

    public static final int DEFAULT_MAX_RECURSION_DEPTH = 100;

    private final int maxRecursionDepth;
    private final boolean enableValidation;

    public ModulePipelineConfiguration(int maxRecursionDepth, boolean enableValidation) {
        if (maxRecursionDepth <= 0) {
            throw new IllegalArgumentException("maxRecursionDepth must be positive");
        }
        this.maxRecursionDepth = maxRecursionDepth;
        this.enableValidation = enableValidation;
    }

    public static ModulePipelineConfiguration defaults() {
        return new ModulePipelineConfiguration(DEFAULT_MAX_RECURSION_DEPTH, true);
    }

    public int getMaxRecursionDepth() {
        return maxRecursionDepth;
    }

    public boolean isEnableValidation() {
        return enableValidation;
    }
}
