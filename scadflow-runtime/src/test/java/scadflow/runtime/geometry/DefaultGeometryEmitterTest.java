package scadflow.runtime.geometry;

import com.scadflow.compiler.ast.Argument;
import com.scadflow.compiler.ast.SourceLocation;
import com.scadflow.compiler.ast.stmt.CallNode;
import com.scadflow.compiler.ast.stmt.Statement;
import com.scadflow.compiler.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import scadflow.runtime.Result;
import scadflow.runtime.expand.ScopedNode;
import scadflow.runtime.expand.TreeExpander;
import scadflow.runtime.interpreter.InterpreterContext;
import scadflow.runtime.interpreter.VariableScope;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultGeometryEmitter 单元测试
 */
class DefaultGeometryEmitterTest {

    private final DefaultGeometryEmitter emitter = new DefaultGeometryEmitter();
    private InterpreterContext context;
    private TreeExpander expander;
    private VariableScope global;

    @BeforeEach
    void setUp() {
        context = new InterpreterContext();
        expander = new TreeExpander(context);
        global = expander.createGlobalScope();
    }

    private Result<List<GeometryNode>, GenerationException> emit(String source) {
        List<ScopedNode> tree = expander.enterBlock(Parser.parse(source, "test.scad"), global, null, null);
        return emitter.emit(tree, context);
    }

    private GeometryNode single(String source) {
        List<GeometryNode> nodes = emit(source).unwrap();
        assertThat(nodes).hasSize(1);
        return nodes.get(0);
    }

    @Nested
    @DisplayName("参数绑定")
    class BindingTests {

        @Test
        @DisplayName("cube 尺寸展开为三维向量并补默认值")
        void testCube() {
            GeometryNode cube = single("cube(5);");
            assertEquals("cube_0", cube.getId());
            assertEquals(Arrays.asList(5.0, 5.0, 5.0), cube.getGeometry().get("size"));
            assertEquals(Boolean.FALSE, cube.getGeometry().get("center"));
        }

        @Test
        @DisplayName("直径换算为半径并继承 $fn")
        void testSphere() {
            GeometryNode sphere = single("$fn = 32; sphere(d = 4);");
            assertEquals(2.0, sphere.getGeometry().get("r"));
            assertFalse(sphere.getGeometry().containsKey("d"));
            assertEquals(32.0, sphere.getGeometry().get("$fn"));
        }

        @Test
        @DisplayName("cylinder 解析上下半径")
        void testCylinder() {
            GeometryNode cylinder = single("cylinder(h = 10, r1 = 2, d2 = 2);");
            assertEquals(2.0, cylinder.getGeometry().get("r1"));
            assertEquals(1.0, cylinder.getGeometry().get("r2"));
            assertEquals(10.0, cylinder.getGeometry().get("h"));
        }

        @Test
        @DisplayName("变量在节点所属作用域中解析")
        void testVariables() {
            GeometryNode cube = single("w = 2; cube([w, w * 2, 1]);");
            assertEquals(Arrays.asList(2.0, 4.0, 1.0), cube.getGeometry().get("size"));
        }
    }

    @Nested
    @DisplayName("树结构")
    class StructureTests {

        @Test
        @DisplayName("变换与布尔运算携带子几何")
        void testChildren() {
            GeometryNode diff = single("difference() { cube(10); translate([1,1,1]) sphere(3); }");
            assertEquals("csg_operation", diff.getMetadata().getCategory());
            assertThat(diff.getChildren()).extracting(GeometryNode::getType).containsExactly("cube", "translate");
            assertThat(diff.getChildren().get(1).getChildren()).extracting(GeometryNode::getId)
                    .containsExactly("sphere_0");
        }

        @Test
        @DisplayName("id 在一次生成中唯一")
        void testUniqueIds() {
            List<GeometryNode> nodes = emit("cube(1); cube(2); union() { cube(3); }").unwrap();
            assertEquals("cube_0", nodes.get(0).getId());
            assertEquals("cube_1", nodes.get(1).getId());
            assertEquals("cube_2", nodes.get(2).getChildren().get(0).getId());
        }

        @Test
        @DisplayName("元数据记录来源节点与作用域")
        void testMetadata() {
            GeometryNode cube = single("%cube(1);");
            assertEquals("cube", cube.getMetadata().getOriginatingNode().getType());
            assertEquals("global", cube.getMetadata().getScopeId());
            assertEquals("background", cube.getMetadata().getModifier());
            assertEquals("primitive", cube.getMetadata().getCategory());
        }

        @Test
        @DisplayName("! 修饰时只输出该子树")
        void testRootModifier() {
            List<GeometryNode> nodes = emit("cube(1); !sphere(2); cylinder(3);").unwrap();
            assertThat(nodes).extracting(GeometryNode::getType).containsExactly("sphere");
        }

        @Test
        @DisplayName("多个 ! 修饰时只输出第一个")
        void testFirstRootWins() {
            List<GeometryNode> nodes = emit("!cube(1); !sphere(1); cylinder(1);").unwrap();
            assertThat(nodes).extracting(GeometryNode::getType).containsExactly("cube");
            assertEquals("root", nodes.get(0).getMetadata().getModifier());
        }

        @Test
        @DisplayName("嵌套的 ! 子树优先于之后的兄弟节点")
        void testNestedRoot() {
            List<GeometryNode> nodes = emit("union() { cube(1); !sphere(2); } !cylinder(3);").unwrap();
            assertThat(nodes).extracting(GeometryNode::getType).containsExactly("sphere");
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("不支持的节点类型")
        void testUnsupportedType() {
            CallNode node = new CallNode(SourceLocation.UNKNOWN, "unsupported_type",
                    Collections.<Argument>emptyList(), Collections.<Statement>emptyList());
            List<ScopedNode> tree = expander.enterBlock(Collections.<Statement>singletonList(node), global, null, null);

            Result<List<GeometryNode>, GenerationException> result = emitter.emit(tree, context);
            assertTrue(result.isErr());
            assertEquals("Unsupported node type: unsupported_type", result.getError().getMessage());
            assertEquals("unsupported_type", result.getError().getNodeType());
        }

        @Test
        @DisplayName("未展开的控制流不受支持")
        void testUnexpandedControlFlow() {
            assertThat(emit("if (true) cube(1);").getError().getMessage())
                    .isEqualTo("Unsupported node type: if_statement");
        }

        @Test
        @DisplayName("负尺寸")
        void testNegativeDimension() {
            assertThat(emit("sphere(-1);").getError().getMessage())
                    .contains("dimension must be non-negative");
            assertThat(emit("cube([1, -2, 3]);").isErr()).isTrue();
        }

        @Test
        @DisplayName("非数值尺寸")
        void testNonNumeric() {
            assertThat(emit("cylinder(h = \"tall\");").getError().getMessage())
                    .isEqualTo("Invalid parameter 'h' for cylinder: expected number, got string");
        }

        @Test
        @DisplayName("参数中的未定义变量")
        void testUndefinedVariable() {
            Result<List<GeometryNode>, GenerationException> result = emit("cube(missing);");
            assertThat(result.getError().getMessage()).isEqualTo("Variable not found: missing");
        }
    }
}
