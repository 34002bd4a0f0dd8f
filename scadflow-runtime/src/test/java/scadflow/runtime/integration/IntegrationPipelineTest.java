package scadflow.runtime.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import scadflow.runtime.Result;
import scadflow.runtime.geometry.DefaultGeometryEmitter;
import scadflow.runtime.geometry.GeometryNode;
import scadflow.runtime.interpreter.InterpreterContext;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * IntegrationPipeline 端到端测试
 */
class IntegrationPipelineTest {

    private IntegrationPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new IntegrationPipeline();
        assertTrue(pipeline.initialize().isOk());
    }

    private ProcessingResult ok(String code) {
        Result<ProcessingResult, IntegrationError> result = pipeline.processCode(code);
        assertTrue(result.isOk(), () -> "expected success but got " + result.getError());
        return result.getValue();
    }

    private IntegrationError err(String code) {
        Result<ProcessingResult, IntegrationError> result = pipeline.processCode(code);
        assertTrue(result.isErr(), "expected failure");
        return result.getError();
    }

    @Nested
    @DisplayName("成功路径")
    class SuccessTests {

        @Test
        @DisplayName("单个基本体")
        void testSinglePrimitive() {
            ProcessingResult result = ok("cube([2,3,4]);");
            assertThat(result.getGeometryNodes()).hasSize(1);
            assertThat(result.getProcessingMetadata().getStagesCompleted())
                    .containsExactly("parsing", "ast_processing", "geometry_generation");
            assertThat(result.getProcessingMetadata().getStageTiming())
                    .containsOnlyKeys("parsing", "ast_processing", "geometry_generation");
        }

        @Test
        @DisplayName("循环中的模块调用")
        void testModuleInLoop() {
            ProcessingResult result = ok(
                    "module box(w, h, d) { cube([w, h, d]); }\n"
                    + "for (i = [0:2]) translate([i * 10, 0, 0]) box(5, 5, 5);");
            assertThat(result.getGeometryNodes()).hasSize(3);
            assertThat(result.getProcessingMetadata().getStagesCompleted())
                    .containsExactly("parsing", "ast_processing", "module_processing", "loop_processing",
                            "geometry_generation");
            GeometryNode first = result.getGeometryNodes().get(0);
            assertEquals("translate", first.getType());
            assertEquals("cube", first.getChildren().get(0).getType());
        }

        @Test
        @DisplayName("条件分支")
        void testConditional() {
            ProcessingResult result = ok("size = 10;\nif (size > 5) { cube(size); } else { sphere(size); }");
            assertThat(result.getGeometryNodes()).extracting(GeometryNode::getType).containsExactly("cube");
            assertThat(result.getProcessingMetadata().getStagesCompleted()).contains("conditional_processing")
                    .doesNotContain("module_processing", "loop_processing");
        }

        @Test
        @DisplayName("条件保护的递归模块")
        void testRecursiveTree() {
            ProcessingResult result = ok(
                    "module tree(d) { if (d > 0) { cylinder(h = d); translate([0, 0, d]) tree(d - 1); } }\n"
                    + "tree(3);");
            assertThat(countPrimitives(result.getGeometryNodes())).isEqualTo(3);
        }

        @Test
        @DisplayName("空源码")
        void testEmpty() {
            ProcessingResult result = ok("");
            assertThat(result.getGeometryNodes()).isEmpty();
            assertThat(result.getProcessingMetadata().getStagesCompleted())
                    .containsExactly("parsing", "ast_processing", "geometry_generation");
        }

        @Test
        @DisplayName("echo 输出进入元数据")
        void testEcho() {
            ProcessingResult result = ok("x = 3; echo(x * 2);");
            assertThat(result.getProcessingMetadata().getEchoMessages()).containsExactly("ECHO: 6");
        }

        @Test
        @DisplayName("性能指标按归属汇总")
        void testMetrics() {
            ProcessingResult result = ok("module m() { cube(1); } m(); m();");
            assertNotNull(result.getProcessingMetadata().getPerformanceMetrics());
            assertThat(result.getProcessingMetadata().getPerformanceMetrics().getOperationsBySubject())
                    .containsKeys("m", "cube");
        }

        @Test
        @DisplayName("重复处理同一源码命中解析缓存")
        void testParseCache() {
            ok("sphere(1);");
            ok("sphere(1);");
            assertEquals(1, pipeline.getParseCacheStats().getHitCount());
        }

        @Test
        @DisplayName("异步处理")
        void testAsync() throws Exception {
            Result<ProcessingResult, IntegrationError> result =
                    pipeline.processCodeAsync("cube(1);").get(10, TimeUnit.SECONDS);
            assertTrue(result.isOk());
        }
    }

    @Nested
    @DisplayName("失败路径")
    class FailureTests {

        @Test
        @DisplayName("未闭合的括号是语法错误")
        void testSyntaxError() {
            IntegrationError error = err("cube([2,3,4);");
            assertEquals(ErrorCategory.SYNTAX_ERROR, error.getCategory());
            assertEquals(PipelineStage.PARSING, error.getStage());
            assertThat(error.getRecoverySuggestions()).contains("Check syntax for missing brackets or semicolons");
            assertEquals("cube([2,3,4);", error.getContext().get("code"));
        }

        @Test
        @DisplayName("嵌套过深是语法错误")
        void testDeepNesting() {
            StringBuilder open = new StringBuilder();
            StringBuilder close = new StringBuilder();
            for (int i = 0; i < 50000; i++) {
                open.append('(');
                close.append(')');
            }
            IntegrationError error = err("x = " + open + "1" + close + "; cube(1);");
            assertEquals(ErrorCategory.SYNTAX_ERROR, error.getCategory());
            assertEquals(PipelineStage.PARSING, error.getStage());
            assertThat(error.getMessage()).contains("Nesting too deep");
        }

        @Test
        @DisplayName("栈耗尽转换为处理错误")
        void testStackExhausted() {
            IntegrationPipeline exhausted = new IntegrationPipeline(IntegrationConfiguration.defaults(),
                    new DefaultSourceParser(), (tree, context) -> {
                        throw new StackOverflowError();
                    });
            exhausted.initialize();
            Result<ProcessingResult, IntegrationError> result = exhausted.processCode("cube(1);");
            assertTrue(result.isErr());
            assertEquals(ErrorCategory.PROCESSING_ERROR, result.getError().getCategory());
            assertEquals(PipelineStage.GEOMETRY_GENERATION, result.getError().getStage());
            assertThat(result.getError().getOriginalCause().getCause()).isInstanceOf(StackOverflowError.class);
        }

        @Test
        @DisplayName("无条件递归是模块错误")
        void testUnboundedRecursion() {
            IntegrationError error = err("module r() { r(); } r();");
            assertEquals(ErrorCategory.MODULE_ERROR, error.getCategory());
            assertEquals(PipelineStage.MODULE_PROCESSING, error.getStage());
            assertThat(error.getMessage()).contains("recursion depth");
        }

        @Test
        @DisplayName("未定义的模块")
        void testModuleNotFound() {
            IntegrationError error = err("gizmo(1);");
            assertEquals(ErrorCategory.MODULE_ERROR, error.getCategory());
            assertThat(error.getMessage()).contains("Module not found");
        }

        @Test
        @DisplayName("条件中的未定义变量")
        void testUndefinedInCondition() {
            IntegrationError error = err("if (size > 5) cube(1);");
            assertEquals(ErrorCategory.PROCESSING_ERROR, error.getCategory());
            assertEquals(PipelineStage.CONDITIONAL_PROCESSING, error.getStage());
            assertEquals("Variable not found: size", error.getMessage());
        }

        @Test
        @DisplayName("非法几何参数")
        void testGenerationError() {
            IntegrationError error = err("cube(-1);");
            assertEquals(ErrorCategory.GENERATION_ERROR, error.getCategory());
            assertThat(error.getRecoverySuggestions()).contains("Verify primitive dimensions");
        }

        @Test
        @DisplayName("阶段关闭时控制流不被展开")
        void testDisabledStage() {
            IntegrationPipeline noConditionals = new IntegrationPipeline(
                    IntegrationConfiguration.builder().enableConditionalProcessing(false).build());
            noConditionals.initialize();
            Result<ProcessingResult, IntegrationError> result = noConditionals.processCode("if (true) cube(1);");
            assertEquals(ErrorCategory.GENERATION_ERROR, result.getError().getCategory());
            assertThat(result.getError().getMessage()).contains("if_statement");
        }

        @Test
        @DisplayName("未初始化是配置错误")
        void testNotInitialized() {
            Result<ProcessingResult, IntegrationError> result = new IntegrationPipeline().processCode("cube(1);");
            assertEquals(ErrorCategory.CONFIGURATION_ERROR, result.getError().getCategory());
            assertThat(result.getError().getRecoverySuggestions())
                    .containsExactly("Call initialize() before processing code");
        }

        @Test
        @DisplayName("非法配置在初始化时报告")
        void testInvalidConfiguration() {
            IntegrationPipeline invalid = new IntegrationPipeline(
                    IntegrationConfiguration.builder().maxRecursionDepth(0).build());
            Result<Void, IntegrationError> init = invalid.initialize();
            assertEquals(ErrorCategory.CONFIGURATION_ERROR, init.getError().getCategory());
            assertFalse(invalid.isInitialized());
        }
    }

    @Test
    @DisplayName("运行结束后释放作用域")
    void testScopesReleased() {
        List<InterpreterContext> seen = new ArrayList<>();
        DefaultGeometryEmitter delegate = new DefaultGeometryEmitter();
        IntegrationPipeline tracking = new IntegrationPipeline(IntegrationConfiguration.defaults(),
                new DefaultSourceParser(), (tree, context) -> {
                    seen.add(context);
                    assertThat(context.getScopes().getScopeCount()).isGreaterThan(1);
                    return delegate.emit(tree, context);
                });
        tracking.initialize();
        assertTrue(tracking.processCode("module m() { cube(1); } for (i = [0:2]) m();").isOk());
        assertEquals(0, seen.get(0).getScopes().getScopeCount());

        assertTrue(tracking.processCode("cube(-1);").isErr());
        assertEquals(0, seen.get(1).getScopes().getScopeCount());
    }

    @Test
    @DisplayName("初始化可重复调用")
    void testInitializeIdempotent() {
        assertTrue(pipeline.initialize().isOk());
        assertTrue(pipeline.isInitialized());
    }

    @Test
    @DisplayName("processSource 一步完成")
    void testProcessSource() {
        Result<ProcessingResult, IntegrationError> result =
                IntegrationPipeline.processSource("sphere(2);", IntegrationConfiguration.defaults());
        assertThat(result.getValue().getGeometryNodes()).hasSize(1);
    }

    private static int countPrimitives(List<GeometryNode> nodes) {
        int n = 0;
        for (GeometryNode node : nodes) {
            if ("primitive".equals(node.getMetadata().getCategory())) n++;
            n += countPrimitives(node.getChildren());
        }
        return n;
    }
}
