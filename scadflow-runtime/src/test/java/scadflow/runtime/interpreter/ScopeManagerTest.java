package scadflow.runtime.interpreter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import scadflow.runtime.ScadException;
import scadflow.runtime.ScadNumber;
import scadflow.runtime.ScadUndef;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ScopeManager 单元测试
 */
class ScopeManagerTest {

    private ScopeManager scopes;
    private VariableScope global;

    @BeforeEach
    void setUp() {
        scopes = new ScopeManager();
        global = scopes.createScope("global");
    }

    @Nested
    @DisplayName("查找")
    class LookupTests {

        @Test
        @DisplayName("子作用域回退到父作用域")
        void testParentFallback() {
            scopes.setVariable(global, "size", ScadNumber.of(10));
            VariableScope child = scopes.createScope("module_box", global);

            assertEquals(ScadNumber.of(10), scopes.getVariable(child, "size"));
            assertFalse(scopes.hasLocalVariable(child, "size"));
            assertEquals(global, scopes.getParent(child));
        }

        @Test
        @DisplayName("子作用域绑定遮蔽父作用域且不修改父作用域")
        void testShadowing() {
            scopes.setVariable(global, "x", ScadNumber.of(1));
            VariableScope child = scopes.createScope("child", global);
            scopes.setVariable(child, "x", ScadNumber.of(2));

            assertEquals(ScadNumber.of(2), scopes.getVariable(child, "x"));
            assertEquals(ScadNumber.of(1), scopes.getVariable(global, "x"));
        }

        @Test
        @DisplayName("找不到返回 null，不抛异常")
        void testNotFound() {
            VariableScope child = scopes.createScope("child", global);
            assertNull(scopes.getVariable(child, "nothing"));
        }

        @Test
        @DisplayName("已定义为 undef 与未定义可区分")
        void testUndefDistinct() {
            scopes.setVariable(global, "u", ScadUndef.UNDEF);
            assertSame(ScadUndef.UNDEF, scopes.getVariable(global, "u"));
            assertNull(scopes.lookup(global).lookup("v"));
        }

        @Test
        @DisplayName("兄弟作用域互不可见")
        void testSiblings() {
            VariableScope a = scopes.createScope("a", global);
            VariableScope b = scopes.createScope("b", global);
            scopes.setVariable(a, "onlyA", ScadNumber.ONE);
            assertNull(scopes.getVariable(b, "onlyA"));
        }
    }

    @Nested
    @DisplayName("生命周期")
    class LifecycleTests {

        @Test
        @DisplayName("清理后绑定被清空且不可再写入")
        void testCleanup() {
            VariableScope frame = scopes.createScope("frame", global);
            scopes.setVariable(frame, "a", ScadNumber.ONE);
            scopes.cleanupScope(frame);

            assertTrue(scopes.isCleanedUp(frame));
            assertThat(scopes.getLocalVariables(frame)).isEmpty();
            assertEquals(1, scopes.getLiveScopeCount());
            assertThatThrownBy(() -> scopes.setVariable(frame, "a", ScadNumber.ONE))
                    .isInstanceOf(ScadException.class);
        }

        @Test
        @DisplayName("重置后旧句柄失效")
        void testReset() {
            scopes.reset();
            assertEquals(0, scopes.getScopeCount());
            assertThatThrownBy(() -> scopes.getVariable(global, "x"))
                    .isInstanceOf(ScadException.class)
                    .hasMessageContaining("Stale scope handle");
        }
    }
}
