package scadflow.runtime.ast;

import com.scadflow.compiler.ast.Argument;
import com.scadflow.compiler.ast.NodeCategory;
import com.scadflow.compiler.ast.SourceLocation;
import com.scadflow.compiler.ast.stmt.CallNode;
import com.scadflow.compiler.ast.stmt.Statement;
import com.scadflow.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import scadflow.runtime.Result;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * AstProcessingPipeline 单元测试
 */
class AstProcessingPipelineTest {

    private static List<Statement> parse(String source) {
        return Parser.parse(source, "test.scad");
    }

    private static PipelineConfiguration noCache() {
        return PipelineConfiguration.builder().enableCaching(false).build();
    }

    @Nested
    @DisplayName("单节点")
    class SingleNodeTests {

        @Test
        @DisplayName("默认执行校验、处理与优化")
        void testStages() {
            PipelineResult result = new AstProcessingPipeline(noCache())
                    .processNode(parse("cube([2,3,4]);").get(0)).unwrap();
            assertThat(result.getStagesExecuted()).containsExactly("validation", "processing", "optimization");
            assertEquals(NodeCategory.PRIMITIVE, result.getProcessedNode().getNodeType());
            assertFalse(result.isBudgetExceeded());
        }

        @Test
        @DisplayName("关闭校验后跳过校验阶段")
        void testValidationDisabled() {
            PipelineConfiguration config = noCache().toBuilder().enableValidation(false).enableOptimization(false).build();
            PipelineResult result = new AstProcessingPipeline(config).processNode(parse("cube(1);").get(0)).unwrap();
            assertThat(result.getStagesExecuted()).containsExactly("processing");
        }

        @Test
        @DisplayName("关闭缓存时重复处理结果一致")
        void testIdempotent() {
            AstProcessingPipeline pipeline = new AstProcessingPipeline(noCache());
            Statement node = parse("translate([1,0,0]) { cube(1); sphere(r = 2); }").get(0);

            ProcessedNode a = pipeline.processNode(node).unwrap().getProcessedNode();
            ProcessedNode b = pipeline.processNode(node).unwrap().getProcessedNode();

            assertNotSame(a, b);
            assertEquals(a.getNodeType(), b.getNodeType());
            assertEquals(a.getParameters(), b.getParameters());
            assertEquals(a.getChildren().size(), b.getChildren().size());
        }

        @Test
        @DisplayName("启用缓存时第二次命中缓存")
        void testCacheHit() {
            AstProcessingPipeline pipeline = new AstProcessingPipeline();
            Statement node = parse("sphere(3);").get(0);

            pipeline.processNode(node).unwrap();
            PipelineResult second = pipeline.processNode(node).unwrap();

            assertThat(second.getStagesExecuted()).contains("cache_hit").doesNotContain("processing");
            assertEquals(1, pipeline.getCacheStats().getHitCount());
        }

        @Test
        @DisplayName("优化器按顺序执行")
        void testOptimizers() {
            List<String> calls = new ArrayList<>();
            NodeOptimizer first = node -> {
                calls.add("first");
                return node;
            };
            NodeOptimizer second = node -> {
                calls.add("second");
                return node;
            };
            new AstProcessingPipeline(noCache(), Arrays.asList(first, second))
                    .processNode(parse("cube(1);").get(0)).unwrap();
            assertThat(calls).containsExactly("first", "second");
        }
    }

    @Nested
    @DisplayName("批量处理")
    class BatchTests {

        @Test
        @DisplayName("输出顺序与输入一致")
        void testOrderPreserved() {
            PipelineResult result = new AstProcessingPipeline(noCache())
                    .processNodes(parse("sphere(1); cube(1); union() {}")).unwrap();
            assertThat(result.getProcessedNodes()).extracting(n -> n.getOriginalNode().getType())
                    .containsExactly("sphere", "cube", "union");
            assertThat(result.getStagesExecuted()).contains("batch_processing");
        }

        @Test
        @DisplayName("任一节点失败则整体失败")
        void testFailFast() {
            List<Statement> nodes = new ArrayList<>(parse("cube(1);"));
            nodes.add(new CallNode(SourceLocation.UNKNOWN, "unsupported_type",
                    Collections.<Argument>emptyList(), Collections.<Statement>emptyList()));
            nodes.addAll(parse("sphere(1);"));

            Result<PipelineResult, ProcessingException> result = new AstProcessingPipeline(noCache()).processNodes(nodes);
            assertTrue(result.isErr());
            assertThat(result.getError().getMessage())
                    .isEqualTo("Pipeline processing failed: Unknown node type: unsupported_type");
        }

        @Test
        @DisplayName("校验失败报告下标")
        void testValidationIndex() {
            List<Statement> nodes = new ArrayList<>(parse("cube(1);"));
            nodes.add(new CallNode(null, "cube", Collections.<Argument>emptyList(), Collections.<Statement>emptyList()));

            Result<PipelineResult, ProcessingException> result = new AstProcessingPipeline(noCache()).processNodes(nodes);
            assertThat(result.getError().getMessage()).isEqualTo("Pipeline validation failed: invalid node cube at index 1");
        }

        @Test
        @DisplayName("空输入成功")
        void testEmpty() {
            PipelineResult result = new AstProcessingPipeline().processNodes(Collections.<Statement>emptyList()).unwrap();
            assertThat(result.getProcessedNodes()).isEmpty();
        }
    }
}
