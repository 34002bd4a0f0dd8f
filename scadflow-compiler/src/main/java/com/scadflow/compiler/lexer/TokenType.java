package com.scadflow.compiler.lexer;

/**
 * 词法单元类型
 */
public enum TokenType {
    // 字面量
    NUMBER_LITERAL,
    STRING_LITERAL,
    IDENTIFIER,

    // 关键词
    KW_MODULE,
    KW_FUNCTION,
    KW_IF,
    KW_ELSE,
    KW_FOR,
    KW_LET,
    KW_EACH,
    KW_TRUE,
    KW_FALSE,
    KW_UNDEF,

    // 分隔符
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    SEMICOLON,      // ;
    COLON,          // :
    DOT,            // .
    QUESTION,       // ?
    ASSIGN,         // =

    // 运算符
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    SLASH,          // /
    PERCENT,        // %
    NOT,            // !
    HASH,           // #
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=
    EQ,             // ==
    NE,             // !=
    AND,            // &&
    OR,             // ||

    // 特殊
    ERROR,
    EOF
}
