package scadflow.runtime.integration;

/**
 * 集成流水线的阶段，声明顺序即执行顺序
 */
public enum PipelineStage {
    INITIALIZATION("initialization"),
    PARSING("parsing"),
    AST_PROCESSING("ast_processing"),
    MODULE_PROCESSING("module_processing"),
    LOOP_PROCESSING("loop_processing"),
    CONDITIONAL_PROCESSING("conditional_processing"),
    GEOMETRY_GENERATION("geometry_generation"),
    PIPELINE("pipeline");

    private final String label;

    PipelineStage(String label) {
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
