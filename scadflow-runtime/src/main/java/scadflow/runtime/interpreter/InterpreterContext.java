package scadflow.runtime.interpreter;

import scadflow.runtime.module.ModulePipelineConfiguration;
import scadflow.runtime.module.ModuleProcessor;
import scadflow.runtime.perf.PerformanceTracker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单次流水线运行的解释器状态
 *
 * <p>作用域表、性能追踪器与 echo 输出都属于本次运行，不在运行之间共享。</p>
 */
public final class InterpreterContext {

    public static final long DEFAULT_MAX_LOOP_ITERATIONS = 100_000L;

    private final ScopeManager scopes;
    private final ExpressionEvaluator evaluator;
    private final ArgumentBinder binder;
    private final ConditionalProcessor conditionalProcessor;
    private final ModuleProcessor moduleProcessor;
    private final PerformanceTracker tracker;
    private final long maxLoopIterations;
    private final List<String> echoMessages = new ArrayList<>();

    /**
     * @param tracker 可为 null
     */
    public InterpreterContext(ModulePipelineConfiguration moduleConfiguration, long maxLoopIterations,
                              PerformanceTracker tracker) {
        this.scopes = new ScopeManager();
        this.evaluator = new ExpressionEvaluator();
        this.binder = new ArgumentBinder(evaluator, scopes);
        this.conditionalProcessor = new ConditionalProcessor(evaluator);
        this.moduleProcessor = new ModuleProcessor(moduleConfiguration, tracker);
        this.tracker = tracker;
        this.maxLoopIterations = maxLoopIterations;
    }

    public InterpreterContext() {
        this(ModulePipelineConfiguration.defaults(), DEFAULT_MAX_LOOP_ITERATIONS, null);
    }

    public ScopeManager getScopes() {
        return scopes;
    }

    public ExpressionEvaluator getEvaluator() {
        return evaluator;
    }

    public ArgumentBinder getBinder() {
        return binder;
    }

    public ConditionalProcessor getConditionalProcessor() {
        return conditionalProcessor;
    }

    public ModuleProcessor getModuleProcessor() {
        return moduleProcessor;
    }

    /** 可能为 null */
    public PerformanceTracker getTracker() {
        return tracker;
    }

    public long getMaxLoopIterations() {
        return maxLoopIterations;
    }

    public void echo(String message) {
        echoMessages.add(message);
    }

    public List<String> getEchoMessages() {
        return Collections.unmodifiableList(echoMessages);
    }
}
