package com.scadflow.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import scadflow.runtime.Result;
import scadflow.runtime.integration.IntegrationConfiguration;
import scadflow.runtime.integration.IntegrationError;
import scadflow.runtime.integration.IntegrationPipeline;
import scadflow.runtime.integration.ProcessingResult;

import static org.junit.jupiter.api.Assertions.*;

class JsonOutputTest {

    private final JsonOutput output = new JsonOutput(false);

    private static Result<ProcessingResult, IntegrationError> process(String code) {
        return IntegrationPipeline.processSource(code, IntegrationConfiguration.defaults());
    }

    @Test
    @DisplayName("几何树的 JSON 结构")
    void testGeometry() {
        ProcessingResult result = process("translate([1, 0, 0]) cube(2);").getValue();
        JsonObject json = JsonParser.parseString(output.render(result, false)).getAsJsonObject();

        JsonArray nodes = json.getAsJsonArray("geometryNodes");
        assertEquals(1, nodes.size());
        JsonObject translate = nodes.get(0).getAsJsonObject();
        assertEquals("translate_0", translate.get("id").getAsString());
        assertEquals("transformation", translate.getAsJsonObject("metadata").get("category").getAsString());

        JsonObject cube = translate.getAsJsonArray("children").get(0).getAsJsonObject();
        JsonArray size = cube.getAsJsonObject("geometry").getAsJsonArray("size");
        assertEquals(3, size.size());
        assertEquals(2.0, size.get(0).getAsDouble());
        assertFalse(cube.getAsJsonObject("geometry").get("center").getAsBoolean());

        JsonObject meta = json.getAsJsonObject("processingMetadata");
        assertEquals("parsing", meta.getAsJsonArray("stagesCompleted").get(0).getAsString());
        assertFalse(meta.has("performanceMetrics"));
    }

    @Test
    @DisplayName("按需输出性能指标")
    void testMetrics() {
        ProcessingResult result = process("sphere(1);").getValue();
        JsonObject meta = JsonParser.parseString(output.render(result, true)).getAsJsonObject()
                .getAsJsonObject("processingMetadata");
        assertTrue(meta.has("performanceMetrics"));
        assertEquals(1, meta.getAsJsonObject("performanceMetrics")
                .getAsJsonObject("operationsBySubject").get("sphere").getAsInt());
    }

    @Test
    @DisplayName("错误的 JSON 结构")
    void testError() {
        IntegrationError error = process("cube(").getError();
        JsonObject json = JsonParser.parseString(output.render(error)).getAsJsonObject();
        assertEquals("syntax_error", json.get("category").getAsString());
        assertEquals("parsing", json.get("stage").getAsString());
        assertTrue(json.getAsJsonArray("recoverySuggestions").size() > 0);
    }
}
