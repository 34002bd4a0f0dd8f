package com.scadflow.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * ScadFlow 词法分析器
 *
 * <p>词法错误不抛异常，而是生成 {@link TokenType#ERROR} Token（literal 为错误信息），
 * 由语法分析器在遇到时报告。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 起始 token 的行列（多行 token 需要）
    private int startLine = 1;
    private int startColumn = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("module", TokenType.KW_MODULE);
        map.put("function", TokenType.KW_FUNCTION);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("for", TokenType.KW_FOR);
        map.put("let", TokenType.KW_LET);
        map.put("each", TokenType.KW_EACH);

        // 常量
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("undef", TokenType.KW_UNDEF);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this.source = source != null ? source : "";
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getSource() {
        return source;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ':': addToken(TokenType.COLON); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '#': addToken(TokenType.HASH); break;

            // 可能是双字符的 Token
            case '=': addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN); break;
            case '!': addToken(match('=') ? TokenType.NE : TokenType.NOT); break;
            case '<': addToken(match('=') ? TokenType.LE : TokenType.LT); break;
            case '>': addToken(match('=') ? TokenType.GE : TokenType.GT); break;
            case '&':
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    error("Unexpected character: '&'");
                }
                break;
            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    error("Unexpected character: '|'");
                }
                break;

            case '/':
                if (match('/')) {
                    // 行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;

            case '.':
                if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            // 空白
            case ' ':
            case '\r':
            case '\t':
                break;
            case '\n':
                newLine();
                break;

            case '"': string(); break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: '" + c + "'");
                }
                break;
        }
    }

    // === 字符辅助 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    /** 标识符首字符：字母、下划线、$（特殊变量） */
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    private boolean isAlphaNumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine, startColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void string() {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                error("Unterminated string");
                return;
            }
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
                value.append(escapeChar());
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private char escapeChar() {
        char c = advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '"': return '"';
            case '\\': return '\\';
            default:
                // 未知转义原样保留
                return c;
        }
    }

    private void number() {
        while (isDigit(peek())) advance();

        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        } else if (peek() == '.' && source.charAt(start) != '.') {
            // 1. 形式
            advance();
        }

        // 指数部分
        if (peek() == 'e' || peek() == 'E') {
            char next = peekNext();
            if (isDigit(next) || ((next == '+' || next == '-')
                    && current + 2 < source.length() && isDigit(source.charAt(current + 2)))) {
                advance();
                if (peek() == '+' || peek() == '-') advance();
                while (isDigit(peek())) advance();
            }
        }

        String text = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER_LITERAL, Double.parseDouble(text));
        } catch (NumberFormatException e) {
            error("Invalid number: " + text);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (peek() == '\n') {
                advance();
                newLine();
            } else {
                advance();
            }
        }
        error("Unterminated block comment");
    }

    private void error(String message) {
        addToken(TokenType.ERROR, message);
    }
}
