package com.scadflow.compiler.ast.stmt;

import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.Binding;
import com.scadflow.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 循环 for (i = [0:2], j = [..]) body
 */
public class ForNode extends Statement {
    private final List<Binding> bindings;
    private final List<Statement> body;

    public ForNode(SourceLocation location, List<Binding> bindings, List<Statement> body) {
        super(location);
        this.bindings = Collections.unmodifiableList(bindings);
        this.body = Collections.unmodifiableList(body);
    }

    public List<Binding> getBindings() {
        return bindings;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public String getType() {
        return "for_loop";
    }

    @Override
    public List<Statement> getNestedNodes() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFor(this, context);
    }
}
