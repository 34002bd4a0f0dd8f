package scadflow.runtime.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class IntegrationConfigurationTest {

    @Test
    @DisplayName("默认值")
    void testDefaults() {
        IntegrationConfiguration config = IntegrationConfiguration.defaults();
        assertTrue(config.isEnableModuleProcessing());
        assertTrue(config.isEnableLoopProcessing());
        assertTrue(config.isEnableConditionalProcessing());
        assertTrue(config.isEnableCaching());
        assertEquals(30000, config.getMaxProcessingTime());
        assertEquals(100, config.getMaxRecursionDepth());
        assertEquals(100000, config.getMaxLoopIterations());
        assertThat(config.validate()).isEmpty();
    }

    @Test
    @DisplayName("从 Properties 加载")
    void testFromProperties() {
        Properties props = new Properties();
        props.setProperty("scadflow.enableCaching", "false");
        props.setProperty("scadflow.maxRecursionDepth", " 12 ");
        props.setProperty("unrelated.key", "x");

        IntegrationConfiguration config = IntegrationConfiguration.fromProperties(props);
        assertFalse(config.isEnableCaching());
        assertEquals(12, config.getMaxRecursionDepth());
        assertTrue(config.isEnableModuleProcessing());
    }

    @Test
    @DisplayName("数值无法解析")
    void testBadNumber() {
        Properties props = new Properties();
        props.setProperty("scadflow.maxLoopIterations", "many");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> IntegrationConfiguration.fromProperties(props));
        assertEquals("Invalid value for scadflow.maxLoopIterations: many", e.getMessage());
    }

    @Test
    @DisplayName("非正的上限被报告")
    void testValidate() {
        IntegrationConfiguration config = IntegrationConfiguration.builder()
                .maxProcessingTime(0)
                .maxLoopIterations(-1)
                .build();
        assertThat(config.validate()).containsExactly(
                "maxProcessingTime must be positive, got 0",
                "maxLoopIterations must be positive, got -1");
    }

    @Test
    @DisplayName("toBuilder 保留原值")
    void testToBuilder() {
        IntegrationConfiguration config = IntegrationConfiguration.builder().maxRecursionDepth(7).build();
        IntegrationConfiguration copy = config.toBuilder().enableCaching(false).build();
        assertEquals(7, copy.getMaxRecursionDepth());
        assertFalse(copy.isEnableCaching());
        assertEquals(7, copy.toModuleConfiguration().getMaxRecursionDepth());
    }
}
