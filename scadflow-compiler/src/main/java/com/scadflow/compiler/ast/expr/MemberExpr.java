package com.scadflow.compiler.ast.expr;

import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.SourceLocation;

/**
 * 分量访问 v.x / v.y / v.z
 */
public class MemberExpr extends Expression {
    private final Expression target;
    private final String member;

    public MemberExpr(SourceLocation location, Expression target, String member) {
        super(location);
        this.target = target;
        this.member = member;
    }

    public Expression getTarget() {
        return target;
    }

    public String getMember() {
        return member;
    }

    @Override
    public String getType() {
        return "member_expression";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMember(this, context);
    }
}
