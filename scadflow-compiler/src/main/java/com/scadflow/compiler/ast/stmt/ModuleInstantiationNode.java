package com.scadflow.compiler.ast.stmt;

import com.scadflow.compiler.ast.Argument;
import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.SourceLocation;
import com.scadflow.compiler.ast.StatementModifier;

import java.util.Collections;
import java.util.List;

/**
 * 用户模块调用 name(args) { children }
 */
public class ModuleInstantiationNode extends Statement {
    private final String name;
    private final List<Argument> arguments;
    private final List<Statement> children;

    public ModuleInstantiationNode(SourceLocation location, String name, List<Argument> arguments,
                                   List<Statement> children, StatementModifier modifier) {
        super(location, modifier);
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
        this.children = Collections.unmodifiableList(children);
    }

    public ModuleInstantiationNode(SourceLocation location, String name, List<Argument> arguments,
                                   List<Statement> children) {
        this(location, name, arguments, children, null);
    }

    public String getName() {
        return name;
    }

    @Override
    public String getType() {
        return "module_instantiation";
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
        return visitor.visitModuleInstantiation(this, context);
    }
}
