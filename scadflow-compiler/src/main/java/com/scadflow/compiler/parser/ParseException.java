package com.scadflow.compiler.parser;

import com.scadflow.compiler.lexer.Token;
import scadflow.runtime.ScadException;

/**
 * 解析异常
 */
public class ParseException extends ScadException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    public ParseException(String message, Token token, String expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    /** 出错行号，无 token 时为 0 */
    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    /** 不含位置信息的原始描述 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            if (token.getType() == com.scadflow.compiler.lexer.TokenType.EOF) {
                sb.append(" (found end of input)");
            } else {
                sb.append(" (found '").append(token.getLexeme()).append("')");
            }
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
