package com.scadflow.compiler.ast.stmt;

import com.scadflow.compiler.ast.Argument;
import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.SourceLocation;
import com.scadflow.compiler.ast.StatementModifier;

import java.util.Collections;
import java.util.List;

/**
 * 内置调用语句，如 cube(10); translate([1,0,0]) sphere(2);
 *
 * <p>type 即被调用的内置名。</p>
 */
public class CallNode extends Statement {
    private final String name;
    private final List<Argument> arguments;
    private final List<Statement> children;

    public CallNode(SourceLocation location, String name, List<Argument> arguments,
                    List<Statement> children, StatementModifier modifier) {
        super(location, modifier);
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
        this.children = Collections.unmodifiableList(children);
    }

    public CallNode(SourceLocation location, String name, List<Argument> arguments, List<Statement> children) {
        this(location, name, arguments, children, null);
    }

    public String getName() {
        return name;
    }

    @Override
    public String getType() {
        return name;
    }

    @Override
    public List<Argument> getArguments() {
        return arguments;
    }

    @Override
    public List<Statement> getChildren() {
        return children;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }
}
