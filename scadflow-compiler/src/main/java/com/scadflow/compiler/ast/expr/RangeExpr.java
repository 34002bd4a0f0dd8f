package com.scadflow.compiler.ast.expr;

import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.SourceLocation;

/**
 * 范围 [start:end] 或 [start:step:end]
 */
public class RangeExpr extends Expression {
    private final Expression start;
    private final Expression step;  // 可为 null
    private final Expression end;

    public RangeExpr(SourceLocation location, Expression start, Expression step, Expression end) {
        super(location);
        this.start = start;
        this.step = step;
        this.end = end;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getStep() {
        return step;
    }

    public Expression getEnd() {
        return end;
    }

    @Override
    public String getType() {
        return "range_expression";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRange(this, context);
    }

    @Override
    public String toString() {
        return step == null ? "[" + start + ":" + end + "]" : "[" + start + ":" + step + ":" + end + "]";
    }
}
