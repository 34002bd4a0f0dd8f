package scadflow.runtime.integration;

import com.scadflow.compiler.ast.stmt.Statement;
import com.scadflow.compiler.parser.ParseException;
import scadflow.runtime.Result;
import scadflow.runtime.ast.AstProcessingPipeline;
import scadflow.runtime.ast.PipelineResult;
import scadflow.runtime.ast.ProcessingException;
import scadflow.runtime.cache.BoundedCache;
import scadflow.runtime.cache.CacheStats;
import scadflow.runtime.cache.CaffeineCache;
import scadflow.runtime.expand.PendingKind;
import scadflow.runtime.expand.ScopedNode;
import scadflow.runtime.expand.TreeExpander;
import scadflow.runtime.geometry.DefaultGeometryEmitter;
import scadflow.runtime.geometry.GenerationException;
import scadflow.runtime.geometry.GeometryEmitter;
import scadflow.runtime.geometry.GeometryNode;
import scadflow.runtime.interpreter.InterpreterContext;
import scadflow.runtime.interpreter.VariableScope;
import scadflow.runtime.perf.MemoryUsage;
import scadflow.runtime.perf.PerformanceTracker;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 集成流水线
 *
 * <p>按固定顺序执行：解析 → AST 处理 → [模块] → [循环] → [条件] → 几何生成。
 * 可选阶段仅在启用且树中存在对应构造时执行，并反复轮转直到没有待展开的构造。
 * 每次运行使用独立的作用域表与性能追踪器。</p>
 */
public final class IntegrationPipeline {

    private static final Logger LOG = Logger.getLogger(IntegrationPipeline.class.getName());

    static final long PARSE_CACHE_SIZE = 256;

    private final IntegrationConfiguration configuration;
    private final SourceParser parser;
    private final GeometryEmitter emitter;
    private final IntegrationErrorHandler errorHandler = new IntegrationErrorHandler();

    private AstProcessingPipeline astPipeline;
    private BoundedCache<String, List<Statement>> parseCache;
    private volatile boolean initialized;

    public IntegrationPipeline(IntegrationConfiguration configuration, SourceParser parser, GeometryEmitter emitter) {
        this.configuration = configuration;
        this.parser = parser;
        this.emitter = emitter;
    }

    public IntegrationPipeline(IntegrationConfiguration configuration) {
        this(configuration, new DefaultSourceParser(), new DefaultGeometryEmitter());
    }

    public IntegrationPipeline() {
        this(IntegrationConfiguration.defaults());
    }

    /**
     * 创建、初始化并处理
     */
    public static Result<ProcessingResult, IntegrationError> processSource(String code,
                                                                          IntegrationConfiguration configuration) {
        IntegrationPipeline pipeline = new IntegrationPipeline(configuration);
        Result<Void, IntegrationError> init = pipeline.initialize();
        if (init.isErr()) {
            return Result.err(init.getError());
        }
        return pipeline.processCode(code);
    }

    public IntegrationConfiguration getConfiguration() {
        return configuration;
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * 初始化，重复调用无副作用
     */
    public synchronized Result<Void, IntegrationError> initialize() {
        if (initialized) {
            return Result.ok(null);
        }
        List<String> problems = configuration.validate();
        if (!problems.isEmpty()) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("configuration", configuration.toString());
            return Result.err(errorHandler.configurationError("Invalid configuration: " + String.join("; ", problems),
                    PipelineStage.INITIALIZATION, context));
        }
        astPipeline = new AstProcessingPipeline(configuration.toPipelineConfiguration());
        parseCache = configuration.isEnableCaching() ? CaffeineCache.<String, List<Statement>>create(PARSE_CACHE_SIZE) : null;
        initialized = true;
        LOG.log(Level.INFO, "Integration pipeline initialized: {0}", configuration);
        return Result.ok(null);
    }

    public CompletableFuture<Result<ProcessingResult, IntegrationError>> processCodeAsync(String code) {
        return CompletableFuture.supplyAsync(() -> processCode(code));
    }

    public Result<ProcessingResult, IntegrationError> processCode(String code) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("code", code);
        if (!initialized) {
            return Result.err(errorHandler.configurationError("Pipeline not initialized. Call initialize() first.",
                    PipelineStage.INITIALIZATION, context));
        }

        long start = System.nanoTime();
        long memoryBefore = MemoryUsage.currentUsed();
        PerformanceTracker tracker = configuration.isEnablePerformanceTracking() ? new PerformanceTracker() : null;
        InterpreterContext interpreter = new InterpreterContext(configuration.toModuleConfiguration(),
                configuration.getMaxLoopIterations(), tracker);
        Map<PipelineStage, Double> timing = new EnumMap<>(PipelineStage.class);
        StageRun run = new StageRun(timing);

        try {
            run.begin(PipelineStage.PARSING);
            Result<List<Statement>, ParseException> parsed = parse(code);
            if (parsed.isErr()) {
                return Result.err(errorHandler.handleError(parsed.getError(), PipelineStage.PARSING, context));
            }
            List<Statement> ast = parsed.getValue();
            run.end();

            run.begin(PipelineStage.AST_PROCESSING);
            Result<PipelineResult, ProcessingException> processed = astPipeline.processNodes(ast);
            if (processed.isErr()) {
                return Result.err(errorHandler.handleError(processed.getError(), PipelineStage.AST_PROCESSING, context));
            }
            TreeExpander expander = new TreeExpander(interpreter);
            VariableScope global = expander.createGlobalScope();
            List<ScopedNode> tree = expander.enterBlock(ast, global, null, null);
            run.end();

            tree = expand(tree, expander, run);

            run.begin(PipelineStage.GEOMETRY_GENERATION);
            Result<List<GeometryNode>, GenerationException> emitted = emitter.emit(tree, interpreter);
            if (emitted.isErr()) {
                return Result.err(errorHandler.handleError(emitted.getError(), PipelineStage.GEOMETRY_GENERATION,
                        context));
            }
            run.end();

            double elapsed = (System.nanoTime() - start) / 1_000_000.0;
            if (elapsed > configuration.getMaxProcessingTime()) {
                LOG.log(Level.WARNING, "Processing took {0} ms, over the budget of {1} ms",
                        new Object[]{elapsed, configuration.getMaxProcessingTime()});
            }
            ProcessingMetadata metadata = new ProcessingMetadata(elapsed,
                    new MemoryUsage(memoryBefore, MemoryUsage.currentUsed()),
                    stageLabels(timing), timingByLabel(timing),
                    tracker != null ? tracker.getPerformanceMetrics() : null,
                    interpreter.getEchoMessages());
            return Result.ok(new ProcessingResult(emitted.getValue(), metadata));
        } catch (RuntimeException e) {
            PipelineStage stage = run.current != null ? run.current : PipelineStage.PIPELINE;
            return Result.err(errorHandler.handleError(e, stage, context));
        } catch (StackOverflowError e) {
            PipelineStage stage = run.current != null ? run.current : PipelineStage.PIPELINE;
            LOG.log(Level.WARNING, "Stack exhausted in stage {0}", stage);
            return Result.err(errorHandler.handleError(
                    new ProcessingException("Structure is nested too deeply to process", stage.getLabel(), e),
                    stage, context));
        } finally {
            interpreter.getScopes().reset();
        }
    }

    /**
     * 模块、循环、条件三个轮次依次执行，直到树中没有已启用的待展开构造
     */
    private List<ScopedNode> expand(List<ScopedNode> tree, TreeExpander expander, StageRun run) {
        List<ScopedNode> current = tree;
        boolean progressed = true;
        while (progressed) {
            progressed = false;
            if (configuration.isEnableModuleProcessing() && TreeExpander.hasPending(current, PendingKind.MODULE)) {
                current = run.apply(PipelineStage.MODULE_PROCESSING, current, expander::expandModules);
                progressed = true;
            }
            if (configuration.isEnableLoopProcessing() && TreeExpander.hasPending(current, PendingKind.LOOP)) {
                current = run.apply(PipelineStage.LOOP_PROCESSING, current, expander::expandLoops);
                progressed = true;
            }
            if (configuration.isEnableConditionalProcessing()
                    && TreeExpander.hasPending(current, PendingKind.CONDITIONAL)) {
                current = run.apply(PipelineStage.CONDITIONAL_PROCESSING, current, expander::expandConditionals);
                progressed = true;
            }
        }
        return current;
    }

    private Result<List<Statement>, ParseException> parse(String code) {
        if (parseCache != null) {
            List<Statement> cached = parseCache.get(code);
            if (cached != null) {
                LOG.log(Level.FINE, "Parse cache hit");
                return Result.ok(cached);
            }
        }
        Result<List<Statement>, ParseException> parsed = parser.parse(code);
        if (parseCache != null && parsed.isOk()) {
            parseCache.put(code, parsed.getValue());
        }
        return parsed;
    }

    private static List<String> stageLabels(Map<PipelineStage, Double> timing) {
        List<String> labels = new ArrayList<>();
        for (PipelineStage stage : timing.keySet()) {
            labels.add(stage.getLabel());
        }
        return labels;
    }

    private static Map<String, Double> timingByLabel(Map<PipelineStage, Double> timing) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<PipelineStage, Double> e : timing.entrySet()) {
            out.put(e.getKey().getLabel(), e.getValue());
        }
        return out;
    }

    /** 解析缓存统计，未启用缓存返回 null */
    public CacheStats getParseCacheStats() {
        return parseCache != null ? parseCache.getStats() : null;
    }

    /** AST 节点缓存统计，未初始化或未启用缓存返回 null */
    public CacheStats getAstCacheStats() {
        return astPipeline != null ? astPipeline.getCacheStats() : null;
    }

    /**
     * 阶段计时，EnumMap 按声明顺序迭代，即规范的阶段顺序
     */
    private static final class StageRun {
        private final Map<PipelineStage, Double> timing;
        private PipelineStage current;
        private long stageStart;

        StageRun(Map<PipelineStage, Double> timing) {
            this.timing = timing;
        }

        void begin(PipelineStage stage) {
            current = stage;
            stageStart = System.nanoTime();
            LOG.log(Level.FINE, "Stage {0} started", stage);
        }

        void end() {
            double ms = (System.nanoTime() - stageStart) / 1_000_000.0;
            timing.merge(current, ms, Double::sum);
            current = null;
        }

        List<ScopedNode> apply(PipelineStage stage, List<ScopedNode> tree, UnaryOperator<List<ScopedNode>> pass) {
            begin(stage);
            List<ScopedNode> result = pass.apply(tree);
            end();
            return result;
        }
    }
}
