package com.scadflow.compiler.ast.expr;

import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.SourceLocation;

/**
 * 标识符引用
 */
public class IdentifierExpr extends Expression {
    private final String name;

    public IdentifierExpr(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String getType() {
        return "identifier";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }

    @Override
    public String toString() {
        return name;
    }
}
