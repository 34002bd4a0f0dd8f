package scadflow.runtime.interpreter;

import scadflow.runtime.ScadException;

/**
 * 表达式求值失败（未解析的变量、未知运算符、非法范围等）
 */
public class EvaluationException extends ScadException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
