package scadflow.runtime.integration;

/**
 * 错误类别
 */
public enum ErrorCategory {
    SYNTAX_ERROR("syntax_error"),
    MODULE_ERROR("module_error"),
    PROCESSING_ERROR("processing_error"),
    GENERATION_ERROR("generation_error"),
    CONFIGURATION_ERROR("configuration_error"),
    INTERNAL_ERROR("internal_error");

    private final String label;

    ErrorCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
