package scadflow.runtime.module;

import scadflow.runtime.ScadException;

/**
 * 模块错误：找不到模块、定义或调用结构非法、递归过深、参数绑定失败
 */
public class ModuleException extends ScadException {

    private final String moduleName;

    public ModuleException(String message, String moduleName) {
        super(message);
        this.moduleName = moduleName;
    }

    public ModuleException(String message, String moduleName, Throwable cause) {
        super(message, cause);
        this.moduleName = moduleName;
    }

    /** 相关模块名，可能为 null */
    public String getModuleName() {
        return moduleName;
    }
}
