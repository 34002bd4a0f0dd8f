package com.scadflow.compiler.ast.stmt;

import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.SourceLocation;
import com.scadflow.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 条件语句 if (cond) then [else else]
 */
public class IfNode extends Statement {
    private final Expression condition;
    private final List<Statement> thenBody;
    private final List<Statement> elseBody;  // 无 else 分支时为 null

    public IfNode(SourceLocation location, Expression condition,
                  List<Statement> thenBody, List<Statement> elseBody) {
        super(location);
        this.condition = condition;
        this.thenBody = Collections.unmodifiableList(thenBody);
        this.elseBody = elseBody != null ? Collections.unmodifiableList(elseBody) : null;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getThenBody() {
        return thenBody;
    }

    public List<Statement> getElseBody() {
        return elseBody;
    }

    public boolean hasElse() {
        return elseBody != null;
    }

    @Override
    public String getType() {
        return "if_statement";
    }

    @Override
    public List<Statement> getNestedNodes() {
        if (elseBody == null) return thenBody;
        List<Statement> all = new ArrayList<>(thenBody);
        all.addAll(elseBody);
        return all;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIf(this, context);
    }
}
