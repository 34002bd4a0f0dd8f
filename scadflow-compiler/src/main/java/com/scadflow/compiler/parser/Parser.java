package com.scadflow.compiler.parser;

import com.scadflow.compiler.ast.SourceLocation;
import com.scadflow.compiler.ast.stmt.Statement;
import com.scadflow.compiler.lexer.Lexer;
import com.scadflow.compiler.lexer.Token;
import com.scadflow.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.scadflow.compiler.lexer.TokenType.*;

/**
 * ScadFlow 语法分析器（递归下降）
 *
 * <p>遇到第一个错误即抛出 {@link ParseException}，不做错误恢复。</p>
 */
public class Parser {

    /** 语句与表达式的最大嵌套层数 */
    public static final int MAX_NESTING_DEPTH = 256;

    final String source;
    final String fileName;
    private final List<Token> tokens;
    private int position;
    private int nesting;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer) {
        this.source = lexer.getSource();
        this.fileName = lexer.getFileName();
        this.tokens = lexer.scanTokens();
        this.position = 0;
        this.current = tokens.get(0);
    }

    /** 便捷入口：解析源码 */
    public static List<Statement> parse(String source, String fileName) {
        return new Parser(new Lexer(source, fileName)).parseProgram();
    }

    /**
     * 解析整个程序，返回顶层语句列表（块语句已展开）
     */
    public List<Statement> parseProgram() {
        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd()) {
            stmtParser.parseStatement(statements, null);
        }
        return statements;
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (current.getType() == ERROR) {
            throw new ParseException((String) current.getLiteral(), current);
        }
        if (position < tokens.size() - 1) {
            position++;
        }
        current = tokens.get(position);
        return previous;
    }

    /**
     * 查看之后第 n 个 token（不消费）
     */
    Token peek(int n) {
        int index = Math.min(position + n, tokens.size() - 1);
        return tokens.get(index);
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 匹配并消费当前 token
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望当前 token 为指定类型，否则报错
     */
    Token expect(TokenType type, String expected) {
        if (check(type)) {
            return advance();
        }
        throw error("Expected " + expected, expected);
    }

    /**
     * 进入一层嵌套，超过 {@link #MAX_NESTING_DEPTH} 报错
     */
    void enterNesting() {
        if (nesting >= MAX_NESTING_DEPTH) {
            throw error("Nesting too deep (limit " + MAX_NESTING_DEPTH + ")");
        }
        nesting++;
    }

    void exitNesting() {
        if (nesting > 0) nesting--;
    }

    boolean isAtEnd() {
        return current.getType() == EOF;
    }

    ParseException error(String message) {
        return error(message, null);
    }

    ParseException error(String message, String expected) {
        // 词法错误优先报告
        if (current.getType() == ERROR) {
            return new ParseException((String) current.getLiteral(), current);
        }
        return new ParseException(message, current, expected);
    }

    // ============ 位置 ============

    /**
     * 从 startToken 到上一个已消费 token 的源码区间
     */
    SourceLocation locationFrom(Token startToken) {
        Token end = previous != null ? previous : startToken;
        if (end.getOffset() < startToken.getOffset()) {
            end = startToken;
        }
        int endOffset = Math.min(end.getEndOffset(), source.length());
        int startOffset = Math.min(startToken.getOffset(), endOffset);
        return new SourceLocation(startToken.getLine(), startToken.getColumn(), startOffset,
                end.getLine(), end.getEndColumn(), endOffset,
                source.substring(startOffset, endOffset));
    }
}
