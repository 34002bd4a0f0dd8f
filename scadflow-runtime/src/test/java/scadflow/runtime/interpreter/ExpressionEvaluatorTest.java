package scadflow.runtime.interpreter;

import com.scadflow.compiler.ast.SourceLocation;
import com.scadflow.compiler.ast.expr.BinaryExpr;
import com.scadflow.compiler.ast.expr.Expression;
import com.scadflow.compiler.ast.expr.IdentifierExpr;
import com.scadflow.compiler.ast.expr.LiteralExpr;
import com.scadflow.compiler.ast.stmt.AssignmentNode;
import com.scadflow.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import scadflow.runtime.ScadBoolean;
import scadflow.runtime.ScadNumber;
import scadflow.runtime.ScadRange;
import scadflow.runtime.ScadString;
import scadflow.runtime.ScadUndef;
import scadflow.runtime.ScadValue;
import scadflow.runtime.ScadVector;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ExpressionEvaluator 单元测试
 */
class ExpressionEvaluatorTest {

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    private static Expression expr(String source) {
        return ((AssignmentNode) Parser.parse("_ = " + source + ";", "expr").get(0)).getValue();
    }

    private ScadValue eval(String source) {
        return evaluator.evaluateExpression(expr(source), VariableLookup.empty());
    }

    private ScadValue eval(String source, Map<String, ?> vars) {
        return evaluator.evaluateExpression(expr(source), vars);
    }

    @Nested
    @DisplayName("字面量与变量")
    class LiteralTests {

        @Test
        @DisplayName("字面量")
        void testLiterals() {
            assertEquals(ScadNumber.of(42), eval("42"));
            assertEquals(ScadString.of("hi"), eval("\"hi\""));
            assertEquals(ScadBoolean.TRUE, eval("true"));
            assertTrue(eval("undef").isUndef());
        }

        @Test
        @DisplayName("变量从变量表解析")
        void testIdentifier() {
            Map<String, Object> vars = new HashMap<>();
            vars.put("size", 10);
            assertEquals(ScadNumber.of(10), eval("size", vars));
        }

        @Test
        @DisplayName("未定义变量抛异常")
        void testUnresolved() {
            assertThatThrownBy(() -> eval("missing"))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessage("Variable not found: missing");
        }

        @Test
        @DisplayName("定义为 undef 的变量不抛异常")
        void testDefinedAsUndef() {
            assertTrue(evaluator.evaluateExpression(expr("x"),
                    (VariableLookup) name -> "x".equals(name) ? ScadUndef.UNDEF : null).isUndef());
        }
    }

    @Nested
    @DisplayName("二元运算")
    class BinaryTests {

        @Test
        @DisplayName("算术")
        void testArithmetic() {
            assertEquals(ScadNumber.of(7), eval("1 + 2 * 3"));
            assertEquals(ScadNumber.of(9), eval("(1 + 2) * 3"));
            assertEquals(ScadNumber.of(2.5), eval("5 / 2"));
            assertEquals(ScadNumber.of(1), eval("7 % 3"));
            assertEquals(ScadNumber.of(-4), eval("-4"));
        }

        @Test
        @DisplayName("向量按元素运算")
        void testVectorArithmetic() {
            assertEquals(ScadVector.ofNumbers(4, 6), eval("[1, 2] + [3, 4]"));
            assertEquals(ScadVector.ofNumbers(2, 4, 6), eval("[1, 2, 3] * 2"));
            assertEquals(ScadNumber.of(11), eval("[1, 2] * [3, 4]"));
        }

        @Test
        @DisplayName("比较与相等")
        void testComparison() {
            assertEquals(ScadBoolean.TRUE, eval("10 > 5"));
            assertEquals(ScadBoolean.FALSE, eval("3 >= 5"));
            assertEquals(ScadBoolean.TRUE, eval("2 <= 2"));
            assertEquals(ScadBoolean.TRUE, eval("\"a\" < \"b\""));
            assertEquals(ScadBoolean.TRUE, eval("[1, 2] == [1, 2]"));
            assertEquals(ScadBoolean.TRUE, eval("1 != \"1\""));
        }

        @Test
        @DisplayName("类型不匹配得到 undef")
        void testTypeMismatch() {
            assertTrue(eval("1 + \"a\"").isUndef());
            assertTrue(eval("true < 2").isUndef());
            assertTrue(eval("[1, 2] + [1, 2, 3]").isUndef());
        }

        @Test
        @DisplayName("逻辑运算两侧都求值")
        void testEagerLogic() {
            assertEquals(ScadBoolean.FALSE, eval("false && true"));
            assertEquals(ScadBoolean.TRUE, eval("true || false"));
            assertThatThrownBy(() -> eval("false && missing"))
                    .hasMessage("Variable not found: missing");
            assertThatThrownBy(() -> eval("true || missing"))
                    .hasMessage("Variable not found: missing");
        }

        @Test
        @DisplayName("未知运算符抛异常")
        void testUnknownOperator() {
            BinaryExpr node = new BinaryExpr(SourceLocation.UNKNOWN,
                    LiteralExpr.number(SourceLocation.UNKNOWN, 1), "^",
                    new IdentifierExpr(SourceLocation.UNKNOWN, "x"));
            assertThatThrownBy(() -> evaluator.evaluateExpression(node, Collections.singletonMap("x", 2)))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessage("Unknown binary operator: ^");
        }
    }

    @Nested
    @DisplayName("其他表达式")
    class OtherTests {

        @Test
        @DisplayName("范围")
        void testRange() {
            ScadValue range = eval("[0:2:6]");
            assertTrue(range.isRange());
            assertEquals(4, ((ScadRange) range).size());
            assertThatThrownBy(() -> eval("[0:\"a\"]")).isInstanceOf(EvaluationException.class);
        }

        @Test
        @DisplayName("下标、成员与三元")
        void testIndexMemberTernary() {
            assertEquals(ScadNumber.of(20), eval("[10, 20, 30][1]"));
            assertTrue(eval("[10, 20][5]").isUndef());
            assertEquals(ScadNumber.of(30), eval("[10, 20, 30].z"));
            assertEquals(ScadString.of("big"), eval("5 > 3 ? \"big\" : \"small\""));
        }

        @Test
        @DisplayName("内置函数")
        void testFunctions() {
            assertEquals(1.0, eval("sin(90)").asDouble(), 1e-9);
            assertEquals(ScadNumber.of(3), eval("len([1, 2, 3])"));
            assertEquals(ScadNumber.of(5), eval("max(2, 5, 1)"));
            assertEquals(ScadNumber.of(8), eval("pow(2, 3)"));
            assertThatThrownBy(() -> eval("nosuch(1)")).hasMessage("Unknown function: nosuch");
        }

        @Test
        @DisplayName("逻辑非")
        void testNot() {
            assertThat(eval("!0")).isEqualTo(ScadBoolean.TRUE);
            assertThat(eval("!\"x\"")).isEqualTo(ScadBoolean.FALSE);
        }
    }
}
