package scadflow.runtime.ast;

import com.scadflow.compiler.ast.AstNode;
import scadflow.runtime.Result;
import scadflow.runtime.cache.BoundedCache;
import scadflow.runtime.cache.CacheStats;
import scadflow.runtime.cache.CaffeineCache;
import scadflow.runtime.perf.MemoryUsage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * AST 处理流水线：validation → processing → optimization
 *
 * <p>批处理共享一个外层计时器，任何节点失败即中止整个批次，不返回部分结果。
 * 缓存以节点对象同一性为键。</p>
 */
public final class AstProcessingPipeline {

    private static final Logger LOG = Logger.getLogger(AstProcessingPipeline.class.getName());

    public static final String STAGE_VALIDATION = "validation";
    public static final String STAGE_PROCESSING = "processing";
    public static final String STAGE_CACHE_HIT = "cache_hit";
    public static final String STAGE_BATCH_PROCESSING = "batch_processing";
    public static final String STAGE_OPTIMIZATION = "optimization";

    private final PipelineConfiguration configuration;
    private final NodeClassifier classifier;
    private final List<NodeOptimizer> optimizers;
    private final BoundedCache<AstNode, ProcessedNode> cache;

    public AstProcessingPipeline(PipelineConfiguration configuration, List<NodeOptimizer> optimizers) {
        this.configuration = configuration;
        this.classifier = new NodeClassifier(configuration.isLenientChildProcessing());
        this.optimizers = Collections.unmodifiableList(new ArrayList<>(optimizers));
        this.cache = configuration.isEnableCaching()
                ? CaffeineCache.<AstNode, ProcessedNode>identityKeyed(configuration.getCacheSize())
                : null;
    }

    public AstProcessingPipeline(PipelineConfiguration configuration) {
        this(configuration, Collections.<NodeOptimizer>emptyList());
    }

    public AstProcessingPipeline() {
        this(PipelineConfiguration.defaults());
    }

    public PipelineConfiguration getConfiguration() {
        return configuration;
    }

    public NodeClassifier getClassifier() {
        return classifier;
    }

    /**
     * 处理单个节点
     */
    public Result<PipelineResult, ProcessingException> processNode(AstNode node) {
        long start = System.nanoTime();
        long memoryBefore = MemoryUsage.currentUsed();
        List<String> stages = new ArrayList<>();

        if (configuration.isEnableValidation()) {
            stages.add(STAGE_VALIDATION);
            if (!classifier.validate(node)) {
                return Result.err(validationFailure(node, -1));
            }
        }

        ProcessedNode processed = cache != null && node != null ? cache.get(node) : null;
        if (processed != null) {
            stages.add(STAGE_CACHE_HIT);
            LOG.log(Level.FINE, "Cache hit for {0}", node.getType());
        } else {
            stages.add(STAGE_PROCESSING);
            Result<ProcessedNode, ProcessingException> result = classifier.processNode(node);
            if (result.isErr()) {
                return Result.err(processingFailure(result.getError()));
            }
            processed = result.getValue();
            if (cache != null) {
                cache.put(node, processed);
            }
        }

        if (configuration.isEnableOptimization()) {
            stages.add(STAGE_OPTIMIZATION);
            processed = optimize(processed);
        }

        return Result.ok(finish(Collections.singletonList(processed), stages,
                processed.getProcessingMetadata().getProcessingTimeMs(), start, memoryBefore));
    }

    /**
     * 批量处理，输出顺序与输入一致，首个失败即中止
     */
    public Result<PipelineResult, ProcessingException> processNodes(List<? extends AstNode> nodes) {
        long start = System.nanoTime();
        long memoryBefore = MemoryUsage.currentUsed();
        List<String> stages = new ArrayList<>();

        if (configuration.isEnableValidation()) {
            stages.add(STAGE_VALIDATION);
            for (int i = 0; i < nodes.size(); i++) {
                if (!classifier.validate(nodes.get(i))) {
                    return Result.err(validationFailure(nodes.get(i), i));
                }
            }
        }

        stages.add(STAGE_BATCH_PROCESSING);
        List<ProcessedNode> processedNodes = new ArrayList<>(nodes.size());
        double nodeTime = 0.0;
        for (AstNode node : nodes) {
            ProcessedNode processed = cache != null && node != null ? cache.get(node) : null;
            if (processed == null) {
                Result<ProcessedNode, ProcessingException> result = classifier.processNode(node);
                if (result.isErr()) {
                    return Result.err(processingFailure(result.getError()));
                }
                processed = result.getValue();
                if (cache != null) {
                    cache.put(node, processed);
                }
            }
            nodeTime += processed.getProcessingMetadata().getProcessingTimeMs();
            processedNodes.add(processed);
        }

        if (configuration.isEnableOptimization()) {
            stages.add(STAGE_OPTIMIZATION);
            for (int i = 0; i < processedNodes.size(); i++) {
                processedNodes.set(i, optimize(processedNodes.get(i)));
            }
        }

        return Result.ok(finish(processedNodes, stages, nodeTime, start, memoryBefore));
    }

    /** 缓存统计，未启用缓存返回 null */
    public CacheStats getCacheStats() {
        return cache != null ? cache.getStats() : null;
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    private ProcessedNode optimize(ProcessedNode node) {
        ProcessedNode current = node;
        for (NodeOptimizer optimizer : optimizers) {
            current = optimizer.optimize(current);
        }
        return current;
    }

    private PipelineResult finish(List<ProcessedNode> nodes, List<String> stages, double nodeTime,
                                  long start, long memoryBefore) {
        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
        boolean exceeded = elapsedMs > configuration.getMaxProcessingTime();
        if (exceeded) {
            LOG.log(Level.WARNING, "AST processing took {0}ms, over the {1}ms budget",
                    new Object[]{String.format("%.1f", elapsedMs), configuration.getMaxProcessingTime()});
        }
        return new PipelineResult(nodes, stages, elapsedMs, nodeTime,
                MemoryUsage.currentUsed() - memoryBefore, exceeded);
    }

    private ProcessingException validationFailure(AstNode node, int index) {
        String type = node != null ? node.getType() : null;
        String where = index >= 0 ? " at index " + index : "";
        return new ProcessingException("Pipeline validation failed: invalid node " + type + where, type);
    }

    private ProcessingException processingFailure(ProcessingException cause) {
        return new ProcessingException("Pipeline processing failed: " + cause.getMessage(),
                cause.getNodeType(), cause);
    }
}
