package com.scadflow.compiler.ast.expr;

import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.SourceLocation;

/**
 * 字面量：数字、字符串、布尔、undef
 */
public class LiteralExpr extends Expression {
    private final LiteralKind kind;
    private final Object value;

    public LiteralExpr(SourceLocation location, LiteralKind kind, Object value) {
        super(location);
        this.kind = kind;
        this.value = value;
    }

    public static LiteralExpr number(SourceLocation location, double value) {
        return new LiteralExpr(location, LiteralKind.NUMBER, value);
    }

    public static LiteralExpr string(SourceLocation location, String value) {
        return new LiteralExpr(location, LiteralKind.STRING, value);
    }

    public static LiteralExpr bool(SourceLocation location, boolean value) {
        return new LiteralExpr(location, LiteralKind.BOOLEAN, value);
    }

    public static LiteralExpr undef(SourceLocation location) {
        return new LiteralExpr(location, LiteralKind.UNDEF, null);
    }

    public LiteralKind getKind() {
        return kind;
    }

    /** Double / String / Boolean，undef 为 null */
    public Object getValue() {
        return value;
    }

    @Override
    public String getType() {
        return kind.getTypeName();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    @Override
    public String toString() {
        if (kind == LiteralKind.STRING) return "\"" + value + "\"";
        if (kind == LiteralKind.UNDEF) return "undef";
        return String.valueOf(value);
    }

    /**
     * 字面量种类
     */
    public enum LiteralKind {
        NUMBER("number"),
        STRING("string"),
        BOOLEAN("boolean"),
        UNDEF("undef");

        private final String typeName;

        LiteralKind(String typeName) {
            this.typeName = typeName;
        }

        public String getTypeName() {
            return typeName;
        }
    }
}
