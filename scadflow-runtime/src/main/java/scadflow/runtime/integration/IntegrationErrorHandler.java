package scadflow.runtime.integration;

import com.scadflow.compiler.parser.ParseException;
import scadflow.runtime.ScadException;
import scadflow.runtime.ast.ProcessingException;
import scadflow.runtime.geometry.GenerationException;
import scadflow.runtime.interpreter.EvaluationException;
import scadflow.runtime.module.ModuleException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 把各阶段的失败转换为 {@link IntegrationError}
 *
 * <p>类别优先由异常类型决定，其次由发生的阶段决定；恢复建议按阶段生成。</p>
 */
public final class IntegrationErrorHandler {

    private static final Logger LOG = Logger.getLogger(IntegrationErrorHandler.class.getName());

    static final String DEFAULT_SUGGESTION = "Check the error message for specific details";

    public IntegrationError handleError(Throwable cause, PipelineStage stage, Map<String, Object> context) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        ErrorCategory category = categorize(cause, stage);
        if (category == ErrorCategory.INTERNAL_ERROR) {
            LOG.log(Level.SEVERE, "Unexpected failure in stage " + stage, cause);
        } else {
            LOG.log(Level.FINE, "Stage {0} failed: {1}", new Object[]{stage, message});
        }
        return new IntegrationError(message, stage, category, cause, context, suggestionsFor(stage, message));
    }

    /** 配置错误：未初始化或配置值非法 */
    public IntegrationError configurationError(String message, PipelineStage stage, Map<String, Object> context) {
        List<String> suggestions = new ArrayList<>();
        if (stage == PipelineStage.INITIALIZATION && message.contains("initialize")) {
            suggestions.add("Call initialize() before processing code");
        } else {
            suggestions.add("Check configuration values: limits must be positive");
        }
        return new IntegrationError(message, stage, ErrorCategory.CONFIGURATION_ERROR, null, context, suggestions);
    }

    public ErrorCategory categorize(Throwable cause, PipelineStage stage) {
        if (cause instanceof ParseException) return ErrorCategory.SYNTAX_ERROR;
        if (cause instanceof ModuleException) return ErrorCategory.MODULE_ERROR;
        if (cause instanceof GenerationException) return ErrorCategory.GENERATION_ERROR;
        if (cause instanceof ProcessingException || cause instanceof EvaluationException) {
            return ErrorCategory.PROCESSING_ERROR;
        }
        if (!(cause instanceof ScadException)) {
            return ErrorCategory.INTERNAL_ERROR;
        }
        switch (stage) {
            case PARSING:
                return ErrorCategory.SYNTAX_ERROR;
            case MODULE_PROCESSING:
                return ErrorCategory.MODULE_ERROR;
            case AST_PROCESSING:
            case LOOP_PROCESSING:
            case CONDITIONAL_PROCESSING:
                return ErrorCategory.PROCESSING_ERROR;
            case GEOMETRY_GENERATION:
                return ErrorCategory.GENERATION_ERROR;
            case INITIALIZATION:
                return ErrorCategory.CONFIGURATION_ERROR;
            default:
                return ErrorCategory.INTERNAL_ERROR;
        }
    }

    public List<String> suggestionsFor(PipelineStage stage, String message) {
        String text = message == null ? "" : message.toLowerCase();
        List<String> suggestions = new ArrayList<>();
        switch (stage) {
            case PARSING:
                suggestions.add("Check syntax for missing brackets or semicolons");
                if (text.contains("bracket") || text.contains("']'") || text.contains("')'") || text.contains("'}'")) {
                    suggestions.add("Check for missing or unmatched brackets");
                }
                if (text.contains("semicolon") || text.contains("';'")) {
                    suggestions.add("Check for missing semicolons");
                }
                break;
            case AST_PROCESSING:
                suggestions.add("Check for unsupported language constructs");
                break;
            case MODULE_PROCESSING:
                suggestions.add("Check module definitions and calls");
                suggestions.add("Verify module parameters");
                if (text.contains("recursion")) {
                    suggestions.add("Guard recursive module calls with a terminating condition");
                }
                break;
            case LOOP_PROCESSING:
                suggestions.add("Check loop ranges and iteration counts");
                break;
            case CONDITIONAL_PROCESSING:
                suggestions.add("Check that variables used in conditions are defined");
                break;
            case GEOMETRY_GENERATION:
                suggestions.add("Check geometry parameters");
                suggestions.add("Verify primitive dimensions");
                break;
            case INITIALIZATION:
                suggestions.add("Call initialize() before processing code");
                break;
            default:
                break;
        }
        if (suggestions.isEmpty()) {
            return Collections.singletonList(DEFAULT_SUGGESTION);
        }
        return suggestions;
    }
}
