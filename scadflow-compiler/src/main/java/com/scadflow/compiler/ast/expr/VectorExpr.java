package com.scadflow.compiler.ast.expr;

import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 向量字面量 [a, b, c]
 */
public class VectorExpr extends Expression {
    private final List<Expression> elements;

    public VectorExpr(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(elements);
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public String getType() {
        return "vector_expression";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVector(this, context);
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
