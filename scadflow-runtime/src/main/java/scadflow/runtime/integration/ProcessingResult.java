package scadflow.runtime.integration;

import scadflow.runtime.geometry.GeometryNode;

import java.util.Collections;
import java.util.List;

/**
 * 成功运行的输出
 */
public final class ProcessingResult {
    private final List<GeometryNode> geometryNodes;
    private final ProcessingMetadata processingMetadata;

    public ProcessingResult(List<GeometryNode> geometryNodes, ProcessingMetadata processingMetadata) {
        this.geometryNodes = Collections.unmodifiableList(geometryNodes);
        this.processingMetadata = processingMetadata;
    }

    public List<GeometryNode> getGeometryNodes() {
        return geometryNodes;
    }

    public ProcessingMetadata getProcessingMetadata() {
        return processingMetadata;
    }
}
