package com.scadflow.compiler.ast.stmt;

import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.Binding;
import com.scadflow.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * let (a = 1, b = a * 2) body
 */
public class LetNode extends Statement {
    private final List<Binding> bindings;
    private final List<Statement> body;

    public LetNode(SourceLocation location, List<Binding> bindings, List<Statement> body) {
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
        return "let_statement";
    }

    @Override
    public List<Statement> getNestedNodes() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLet(this, context);
    }
}
