package com.scadflow.compiler.ast.expr;

import com.scadflow.compiler.ast.AstNode;
import com.scadflow.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
