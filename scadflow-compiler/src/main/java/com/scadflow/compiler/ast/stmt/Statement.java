package com.scadflow.compiler.ast.stmt;

import com.scadflow.compiler.ast.AstNode;
import com.scadflow.compiler.ast.SourceLocation;
import com.scadflow.compiler.ast.StatementModifier;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {
    protected final StatementModifier modifier;

    protected Statement(SourceLocation location, StatementModifier modifier) {
        super(location);
        this.modifier = modifier;
    }

    protected Statement(SourceLocation location) {
        this(location, null);
    }

    /** 修饰符，未标注时为 null */
    public StatementModifier getModifier() {
        return modifier;
    }

    /** 是否被 * 禁用 */
    public boolean isDisabled() {
        return modifier == StatementModifier.DISABLE;
    }
}
