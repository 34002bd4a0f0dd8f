package scadflow.runtime.geometry;

import scadflow.runtime.ScadException;

/**
 * 几何生成失败：不支持的节点类型或非法的几何参数
 */
public class GenerationException extends ScadException {

    private final String nodeType;

    public GenerationException(String message, String nodeType) {
        super(message);
        this.nodeType = nodeType;
    }

    public GenerationException(String message, String nodeType, Throwable cause) {
        super(message, cause);
        this.nodeType = nodeType;
    }

    public String getNodeType() {
        return nodeType;
    }
}
