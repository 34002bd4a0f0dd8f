package scadflow.runtime.ast;

import scadflow.runtime.ScadException;

/**
 * AST 校验或分类失败
 */
public class ProcessingException extends ScadException {

    private final String nodeType;

    public ProcessingException(String message, String nodeType) {
        super(message);
        this.nodeType = nodeType;
    }

    public ProcessingException(String message, String nodeType, Throwable cause) {
        super(message, cause);
        this.nodeType = nodeType;
    }

    /** 出错节点的类型名，可能为 null */
    public String getNodeType() {
        return nodeType;
    }
}
