package com.scadflow.compiler.parser;

import com.scadflow.compiler.ast.Argument;
import com.scadflow.compiler.ast.StatementModifier;
import com.scadflow.compiler.ast.expr.*;
import com.scadflow.compiler.ast.stmt.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Parser 单元测试
 */
class ParserTest {

    private List<Statement> parse(String source) {
        return Parser.parse(source, "test.scad");
    }

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("内置调用")
        void testBuiltinCall() {
            List<Statement> stmts = parse("cube([2,3,4]);");
            assertThat(stmts).hasSize(1);
            CallNode cube = (CallNode) stmts.get(0);
            assertThat(cube.getType()).isEqualTo("cube");
            assertThat(cube.getArguments()).hasSize(1);
            assertThat(cube.getArguments().get(0).getValue()).isInstanceOf(VectorExpr.class);
            assertThat(cube.getLocation().getText()).isEqualTo("cube([2,3,4]);");
        }

        @Test
        @DisplayName("变换带子节点")
        void testTransformationWithChildren() {
            List<Statement> stmts = parse("translate([1,0,0]) { cube(1); sphere(r = 2); }");
            CallNode translate = (CallNode) stmts.get(0);
            assertThat(translate.getChildren()).extracting(Statement::getType).containsExactly("cube", "sphere");
            Argument r = translate.getChildren().get(1).getArguments().get(0);
            assertThat(r.getName()).isEqualTo("r");
        }

        @Test
        @DisplayName("模块定义和调用")
        void testModuleDefinitionAndCall() {
            List<Statement> stmts = parse("module box(w, h = 2) { cube([w, w, h]); } box(5);");
            ModuleDefinitionNode def = (ModuleDefinitionNode) stmts.get(0);
            assertThat(def.getName()).isEqualTo("box");
            assertThat(def.getParameters()).hasSize(2);
            assertThat(def.getParameters().get(0).hasDefault()).isFalse();
            assertThat(def.getParameters().get(1).getDefaultValue()).isInstanceOf(LiteralExpr.class);
            assertThat(def.getBody()).hasSize(1);

            ModuleInstantiationNode call = (ModuleInstantiationNode) stmts.get(1);
            assertThat(call.getType()).isEqualTo("module_instantiation");
            assertThat(call.getName()).isEqualTo("box");
        }

        @Test
        @DisplayName("if / else")
        void testIfElse() {
            IfNode node = (IfNode) parse("if (size > 5) cube(1); else sphere(1);").get(0);
            assertThat(node.getCondition()).isInstanceOf(BinaryExpr.class);
            assertThat(node.getThenBody()).extracting(Statement::getType).containsExactly("cube");
            assertThat(node.getElseBody()).extracting(Statement::getType).containsExactly("sphere");
        }

        @Test
        @DisplayName("for 多变量")
        void testForLoop() {
            ForNode node = (ForNode) parse("for (i = [0:2], j = [1, 2]) cube(i);").get(0);
            assertThat(node.getBindings()).hasSize(2);
            assertThat(node.getBindings().get(0).getValue()).isInstanceOf(RangeExpr.class);
        }

        @Test
        @DisplayName("赋值与修饰符")
        void testAssignmentAndModifiers() {
            List<Statement> stmts = parse("$fn = 32; #cube(1); *sphere(1);");
            assertThat(stmts.get(0)).isInstanceOf(AssignmentNode.class);
            assertThat(((AssignmentNode) stmts.get(0)).getName()).isEqualTo("$fn");
            assertThat(stmts.get(1).getModifier()).isEqualTo(StatementModifier.HIGHLIGHT);
            assertThat(stmts.get(2).isDisabled()).isTrue();
        }

        @Test
        @DisplayName("块语句展开")
        void testBlockFlattening() {
            assertThat(parse("{ cube(1); { sphere(1); } } ;")).hasSize(2);
        }

        @Test
        @DisplayName("空源码")
        void testEmpty() {
            assertThat(parse("")).isEmpty();
            assertThat(parse("// only comment\n")).isEmpty();
        }
    }

    @Nested
    @DisplayName("表达式优先级")
    class PrecedenceTests {

        private Expression expr(String source) {
            return ((AssignmentNode) parse("x = " + source + ";").get(0)).getValue();
        }

        @Test
        @DisplayName("乘法优先于加法")
        void testMultiplicationBindsTighter() {
            BinaryExpr e = (BinaryExpr) expr("1 + 2 * 3");
            assertThat(e.getOperator()).isEqualTo("+");
            assertThat(((BinaryExpr) e.getRight()).getOperator()).isEqualTo("*");
        }

        @Test
        @DisplayName("比较优先于逻辑与")
        void testComparisonBeforeAnd() {
            BinaryExpr e = (BinaryExpr) expr("a > 1 && b < 2");
            assertThat(e.getOperator()).isEqualTo("&&");
            assertThat(((BinaryExpr) e.getLeft()).getOperator()).isEqualTo(">");
        }

        @Test
        @DisplayName("三元、一元、下标和分量")
        void testMiscForms() {
            assertThat(expr("a ? 1 : 2")).isInstanceOf(TernaryExpr.class);
            assertThat(expr("-a")).isInstanceOf(UnaryExpr.class);
            assertThat(expr("v[0]")).isInstanceOf(IndexExpr.class);
            assertThat(expr("v.x")).isInstanceOf(MemberExpr.class);
            assertThat(expr("max(1, 2)")).isInstanceOf(CallExpr.class);
            RangeExpr r = (RangeExpr) expr("[0:2:10]");
            assertThat(r.getStep()).isNotNull();
        }
    }

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("未闭合方括号带行列信息")
        void testUnterminatedBracket() {
            assertThatThrownBy(() -> parse("cube([2,3,4);"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("']'")
                    .hasMessageContaining("line 1");
        }

        @Test
        @DisplayName("缺少分号")
        void testMissingSemicolon() {
            assertThatThrownBy(() -> parse("x = 1"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("';'");
        }

        @Test
        @DisplayName("不支持自定义函数")
        void testFunctionRejected() {
            assertThatThrownBy(() -> parse("function f(x) = x;"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("not supported");
        }

        @Test
        @DisplayName("词法错误转为解析错误")
        void testLexerErrorSurfaces() {
            assertThatThrownBy(() -> parse("cube(\"abc);"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Unterminated string");
        }

        @Test
        @DisplayName("重复形参")
        void testDuplicateParameter() {
            assertThatThrownBy(() -> parse("module m(a, a) {}"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Duplicate parameter");
        }

        @Test
        @DisplayName("括号嵌套过深")
        void testDeepParentheses() {
            String source = "x = " + repeat("(", 50000) + "1" + repeat(")", 50000) + ";";
            assertThatThrownBy(() -> parse(source))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Nesting too deep (limit " + Parser.MAX_NESTING_DEPTH + ")")
                    .hasMessageContaining("line 1");
        }

        @Test
        @DisplayName("一元运算符与三元表达式嵌套过深")
        void testDeepUnaryAndTernary() {
            assertThatThrownBy(() -> parse("x = " + repeat("-", 50000) + "1;"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Nesting too deep");
            assertThatThrownBy(() -> parse("x = " + repeat("1 ? 1 : ", 50000) + "1;"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Nesting too deep");
        }

        @Test
        @DisplayName("语句嵌套过深")
        void testDeepStatements() {
            assertThatThrownBy(() -> parse(repeat("translate([1,0,0]) ", 50000) + "cube(1);"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Nesting too deep");
            assertThatThrownBy(() -> parse(repeat("{", 50000) + repeat("}", 50000)))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Nesting too deep");
        }

        @Test
        @DisplayName("上限以内的嵌套正常解析")
        void testNestingWithinLimit() {
            assertThat(parse("x = " + repeat("(", 100) + "1" + repeat(")", 100) + ";")).hasSize(1);
        }
    }

    private static String repeat(String s, int n) {
        StringBuilder sb = new StringBuilder(s.length() * n);
        for (int i = 0; i < n; i++) sb.append(s);
        return sb.toString();
    }
}
