package scadflow.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScadValue 值类型单元测试
 */
class ScadValueTest {

    @Nested
    @DisplayName("真值判断")
    class TruthinessTests {

        @Test
        @DisplayName("数字：非零为真")
        void testNumberTruthiness() {
            assertTrue(ScadNumber.of(3).isTruthy());
            assertFalse(ScadNumber.of(0).isTruthy());
            assertFalse(ScadNumber.of(Double.NaN).isTruthy());
        }

        @Test
        @DisplayName("字符串和向量：非空为真")
        void testStringAndVector() {
            assertTrue(ScadString.of("a").isTruthy());
            assertFalse(ScadString.of("").isTruthy());
            assertTrue(ScadVector.ofNumbers(1).isTruthy());
            assertFalse(ScadVector.EMPTY.isTruthy());
        }

        @Test
        @DisplayName("undef 为假")
        void testUndef() {
            assertFalse(ScadUndef.UNDEF.isTruthy());
        }
    }

    @Nested
    @DisplayName("结构相等")
    class EqualityTests {

        @Test
        @DisplayName("向量逐元素比较")
        void testVectorEquality() {
            assertEquals(ScadVector.ofNumbers(1, 2, 3), ScadVector.ofNumbers(1, 2, 3));
            assertNotEquals(ScadVector.ofNumbers(1, 2), ScadVector.ofNumbers(1, 2, 3));
        }

        @Test
        @DisplayName("不同类型不相等")
        void testCrossTypeInequality() {
            assertFalse(ScadNumber.of(1).valueEquals(ScadBoolean.TRUE));
            assertFalse(ScadString.of("1").valueEquals(ScadNumber.of(1)));
        }
    }

    @Nested
    @DisplayName("Java 值转换")
    class ConversionTests {

        @Test
        @DisplayName("fromJava 转换嵌套列表")
        void testFromJava() {
            ScadValue v = ScadValue.fromJava(Arrays.asList(1, "x", true, null));
            assertTrue(v.isVector());
            ScadVector vec = (ScadVector) v;
            assertEquals(4, vec.size());
            assertTrue(vec.get(0).isNumber());
            assertTrue(vec.get(1).isString());
            assertTrue(vec.get(2).isBoolean());
            assertTrue(vec.get(3).isUndef());
        }

        @Test
        @DisplayName("toJavaValue 输出普通 Java 值")
        void testToJavaValue() {
            Object java = ScadVector.ofNumbers(2, 3, 4).toJavaValue();
            assertEquals(Arrays.asList(2.0, 3.0, 4.0), java);
            assertNull(ScadUndef.UNDEF.toJavaValue());
        }

        @Test
        @DisplayName("越界下标返回 undef")
        void testOutOfBounds() {
            assertTrue(ScadVector.ofNumbers(1).get(5).isUndef());
        }

        @Test
        @DisplayName("整数输出不带小数")
        void testNumberToString() {
            assertEquals("3", ScadNumber.of(3).toString());
            assertEquals("2.5", ScadNumber.of(2.5).toString());
        }
    }

    @Nested
    @DisplayName("范围")
    class RangeTests {

        @Test
        @DisplayName("闭区间包含端点")
        void testInclusiveRange() {
            ScadRange r = new ScadRange(0, 2);
            assertEquals(3, r.size());
            assertEquals(2.0, r.get(2));
        }

        @Test
        @DisplayName("带步长")
        void testStep() {
            ScadRange r = new ScadRange(0, 2, 6);
            assertEquals(4, r.size());
            List<Double> values = Arrays.asList(r.get(0), r.get(1), r.get(2), r.get(3));
            assertEquals(Arrays.asList(0.0, 2.0, 4.0, 6.0), values);
        }

        @Test
        @DisplayName("反向或零步长为空")
        void testEmptyRanges() {
            assertEquals(0, new ScadRange(5, 1, 0).size());
            assertEquals(0, new ScadRange(0, 0, 5).size());
        }

        @Test
        @DisplayName("元素个数不会溢出")
        void testHugeRange() {
            assertEquals(Long.MAX_VALUE, new ScadRange(0, 1, 1e19).size());
            assertEquals(Long.MAX_VALUE, new ScadRange(-1e19, 1, 1e19).size());
        }

        @Test
        @DisplayName("浮点步长容忍误差")
        void testFractionalStep() {
            assertEquals(11, new ScadRange(0, 0.1, 1).size());
        }
    }
}
