package com.scadflow.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import scadflow.runtime.geometry.GeometryMetadata;
import scadflow.runtime.geometry.GeometryNode;
import scadflow.runtime.integration.IntegrationError;
import scadflow.runtime.integration.ProcessingMetadata;
import scadflow.runtime.integration.ProcessingResult;
import scadflow.runtime.perf.PerformanceMetrics;
import scadflow.runtime.perf.PerformanceRecord;

import java.util.List;
import java.util.Map;

/**
 * 处理结果与错误的 JSON 渲染
 */
public final class JsonOutput {

    private final Gson gson;

    public JsonOutput(boolean pretty) {
        GsonBuilder builder = new GsonBuilder().serializeNulls();
        if (pretty) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    public String render(ProcessingResult result, boolean includeMetrics) {
        return gson.toJson(toJson(result, includeMetrics));
    }

    public String render(IntegrationError error) {
        return gson.toJson(toJson(error));
    }

    JsonObject toJson(ProcessingResult result, boolean includeMetrics) {
        JsonObject root = new JsonObject();
        root.add("geometryNodes", nodes(result.getGeometryNodes()));

        ProcessingMetadata metadata = result.getProcessingMetadata();
        JsonObject meta = new JsonObject();
        meta.addProperty("processingTime", metadata.getProcessingTimeMs());
        meta.addProperty("memoryUsage", metadata.getMemoryUsage().getDelta());
        meta.add("stagesCompleted", gson.toJsonTree(metadata.getStagesCompleted()));
        meta.add("stageTiming", gson.toJsonTree(metadata.getStageTiming()));
        if (!metadata.getEchoMessages().isEmpty()) {
            meta.add("echo", gson.toJsonTree(metadata.getEchoMessages()));
        }
        if (includeMetrics && metadata.getPerformanceMetrics() != null) {
            meta.add("performanceMetrics", metrics(metadata.getPerformanceMetrics()));
        }
        root.add("processingMetadata", meta);
        return root;
    }

    JsonObject toJson(IntegrationError error) {
        JsonObject json = new JsonObject();
        json.addProperty("message", error.getMessage());
        json.addProperty("stage", error.getStage().getLabel());
        json.addProperty("category", error.getCategory().getLabel());
        json.add("recoverySuggestions", gson.toJsonTree(error.getRecoverySuggestions()));
        return json;
    }

    private JsonArray nodes(List<GeometryNode> nodes) {
        JsonArray array = new JsonArray();
        for (GeometryNode node : nodes) {
            JsonObject json = new JsonObject();
            json.addProperty("id", node.getId());
            json.addProperty("type", node.getType());
            JsonObject geometry = new JsonObject();
            for (Map.Entry<String, Object> e : node.getGeometry().entrySet()) {
                geometry.add(e.getKey(), gson.toJsonTree(e.getValue()));
            }
            json.add("geometry", geometry);

            GeometryMetadata md = node.getMetadata();
            JsonObject metadata = new JsonObject();
            metadata.addProperty("category", md.getCategory());
            metadata.addProperty("scope", md.getScopeId());
            metadata.addProperty("line", md.getOriginatingNode().getLocation().getLine());
            if (md.getModifier() != null) {
                metadata.addProperty("modifier", md.getModifier());
            }
            json.add("metadata", metadata);
            if (!node.getChildren().isEmpty()) {
                json.add("children", nodes(node.getChildren()));
            }
            array.add(json);
        }
        return array;
    }

    private JsonObject metrics(PerformanceMetrics metrics) {
        JsonObject json = new JsonObject();
        json.addProperty("totalOperations", metrics.getTotalOperations());
        json.addProperty("averageProcessingTime", metrics.getAverageProcessingTime());
        json.addProperty("totalProcessingTime", metrics.getTotalProcessingTime());
        json.addProperty("totalMemoryUsage", metrics.getTotalMemoryUsage());
        json.add("operationsBySubject", gson.toJsonTree(metrics.getOperationsBySubject()));
        JsonArray slowest = new JsonArray();
        for (PerformanceRecord r : metrics.getSlowestOperations()) {
            JsonObject op = new JsonObject();
            op.addProperty("operation", r.getOperationName());
            op.addProperty("subject", r.getSubjectLabel());
            op.addProperty("time", r.getProcessingTimeMs());
            slowest.add(op);
        }
        json.add("slowestOperations", slowest);
        return json;
    }
}
