package com.scadflow.compiler.ast;

/**
 * 源码位置区间（起止行、列、偏移以及对应的源码片段）
 */
public final class SourceLocation {
    private final int line;
    private final int column;
    private final int offset;
    private final int endLine;
    private final int endColumn;
    private final int endOffset;
    private final String text;

    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0, 0, 0, 0, 0, "");

    public SourceLocation(int line, int column, int offset,
                          int endLine, int endColumn, int endOffset, String text) {
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.endOffset = endOffset;
        this.text = text != null ? text : "";
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public int getEndOffset() {
        return endOffset;
    }

    /** 区间对应的源码文本 */
    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return line + ":" + column + "-" + endLine + ":" + endColumn;
    }
}
