package scadflow.runtime.interpreter;

import com.scadflow.compiler.ast.stmt.Statement;
import com.scadflow.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import scadflow.runtime.Result;
import scadflow.runtime.ScadException;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ConditionalProcessor 单元测试
 */
class ConditionalProcessorTest {

    private static final String IF_ELSE = "if (size > 5) { cube(size); } else { sphere(size); }";

    private final ConditionalProcessor processor = new ConditionalProcessor();

    private static Statement first(String source) {
        return Parser.parse(source, "test.scad").get(0);
    }

    @Test
    @DisplayName("条件为真选择 then 分支")
    void testThenBranch() {
        ConditionalResult result = processor.processConditional(first(IF_ELSE),
                Collections.singletonMap("size", 10)).unwrap();

        assertEquals(ConditionalResult.Branch.THEN, result.getExecutedBranch());
        assertEquals("then", result.getExecutedBranch().getLabel());
        assertTrue(result.getConditionResult());
        assertEquals("cube", result.getResultingNodes().get(0).getType());
    }

    @Test
    @DisplayName("条件为假选择 else 分支")
    void testElseBranch() {
        ConditionalResult result = processor.processConditional(first(IF_ELSE),
                Collections.singletonMap("size", 3)).unwrap();

        assertEquals(ConditionalResult.Branch.ELSE, result.getExecutedBranch());
        assertEquals("sphere", result.getResultingNodes().get(0).getType());
    }

    @Test
    @DisplayName("无 else 且条件为假时结果为空")
    void testNoneBranch() {
        ConditionalResult result = processor.processConditional(first("if (false) cube(1);"),
                Collections.<String, Object>emptyMap()).unwrap();

        assertEquals(ConditionalResult.Branch.NONE, result.getExecutedBranch());
        assertThat(result.getResultingNodes()).isEmpty();
    }

    @Test
    @DisplayName("条件中的未定义变量使处理失败")
    void testMissingVariable() {
        Result<ConditionalResult, ScadException> result = processor.processConditional(first(IF_ELSE),
                Collections.<String, Object>emptyMap());

        assertTrue(result.isErr());
        assertEquals("Variable not found: size", result.getError().getMessage());
    }

    @Test
    @DisplayName("非 if 节点不受支持")
    void testUnsupportedNode() {
        Result<ConditionalResult, ScadException> result = processor.processConditional(first("cube(1);"),
                Collections.<String, Object>emptyMap());

        assertThat(result.getError().getMessage()).isEqualTo("Unsupported conditional node type: cube");
    }
}
