package scadflow.runtime;

/**
 * ScadFlow 基础运行时异常（无源位置信息）。
 *
 * <p>编译器与运行时的各类异常（解析、求值、模块、几何生成）均继承此类，
 * 组件边界处再统一转换为 {@link Result}。</p>
 */
public class ScadException extends RuntimeException {

    public ScadException(String message) {
        super(message);
    }

    public ScadException(String message, Throwable cause) {
        super(message, cause);
    }
}
