package com.scadflow.compiler.ast;

/**
 * 语句修饰符（! # % *）
 */
public enum StatementModifier {
    /** ! 仅渲染此子树 */
    ROOT('!', "root"),
    /** # 高亮 */
    HIGHLIGHT('#', "highlight"),
    /** % 背景 */
    BACKGROUND('%', "background"),
    /** * 禁用 */
    DISABLE('*', "disable");

    private final char symbol;
    private final String label;

    StatementModifier(char symbol, String label) {
        this.symbol = symbol;
        this.label = label;
    }

    public char getSymbol() {
        return symbol;
    }

    public String getLabel() {
        return label;
    }

    public static StatementModifier fromSymbol(char c) {
        for (StatementModifier m : values()) {
            if (m.symbol == c) return m;
        }
        return null;
    }
}
