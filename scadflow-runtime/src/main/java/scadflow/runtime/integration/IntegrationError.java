package scadflow.runtime.integration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 流水线失败的结构化描述，返回给调用方直接展示
 */
public final class IntegrationError {
    private final String message;
    private final PipelineStage stage;
    private final ErrorCategory category;
    private final Throwable originalCause;
    private final Map<String, Object> context;
    private final List<String> recoverySuggestions;

    public IntegrationError(String message, PipelineStage stage, ErrorCategory category, Throwable originalCause,
                            Map<String, Object> context, List<String> recoverySuggestions) {
        this.message = message;
        this.stage = stage;
        this.category = category;
        this.originalCause = originalCause;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.recoverySuggestions = Collections.unmodifiableList(recoverySuggestions);
    }

    public String getMessage() {
        return message;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /** 触发失败的异常，可能为 null */
    public Throwable getOriginalCause() {
        return originalCause;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public List<String> getRecoverySuggestions() {
        return recoverySuggestions;
    }

    @Override
    public String toString() {
        return "[" + category + " @ " + stage + "] " + message;
    }
}
