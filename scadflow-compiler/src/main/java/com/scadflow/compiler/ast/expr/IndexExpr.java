package com.scadflow.compiler.ast.expr;

import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.SourceLocation;

/**
 * 下标访问 v[i]
 */
public class IndexExpr extends Expression {
    private final Expression target;
    private final Expression index;

    public IndexExpr(SourceLocation location, Expression target, Expression index) {
        super(location);
        this.target = target;
        this.index = index;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public String getType() {
        return "index_expression";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndex(this, context);
    }
}
