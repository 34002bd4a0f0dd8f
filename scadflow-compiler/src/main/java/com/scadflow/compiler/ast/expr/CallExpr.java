package com.scadflow.compiler.ast.expr;

import com.scadflow.compiler.ast.Argument;
import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 内置函数调用 name(args)
 */
public class CallExpr extends Expression {
    private final String name;
    private final List<Argument> arguments;

    public CallExpr(SourceLocation location, String name, List<Argument> arguments) {
        super(location);
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public String getName() {
        return name;
    }

    @Override
    public List<Argument> getArguments() {
        return arguments;
    }

    @Override
    public String getType() {
        return "function_call";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCall(this, context);
    }

    @Override
    public String toString() {
        return name + arguments;
    }
}
