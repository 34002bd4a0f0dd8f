package com.scadflow.compiler.ast.stmt;

import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.SourceLocation;
import com.scadflow.compiler.ast.expr.Expression;

/**
 * 赋值语句 name = expr;
 */
public class AssignmentNode extends Statement {
    private final String name;
    private final Expression value;

    public AssignmentNode(SourceLocation location, String name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public String getType() {
        return "assignment";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignment(this, context);
    }
}
