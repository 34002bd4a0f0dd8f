package com.scadflow.compiler.ast;

import java.util.Collections;
import java.util.List;

/**
 * AST 节点基类
 *
 * <p>节点以 type 字符串区分，创建后不可变；各处理阶段只构建新结构，不修改节点。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 节点类型名，如 cube、module_definition、binary_expression */
    public abstract String getType();

    /** 调用参数（按书写顺序） */
    public List<Argument> getArguments() {
        return Collections.emptyList();
    }

    /** 子节点（变换、布尔运算的作用对象） */
    public List<? extends AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * 所有嵌套语句节点：子节点加上控制流节点的分支体、循环体、模块体
     */
    public List<? extends AstNode> getNestedNodes() {
        return getChildren();
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

    @Override
    public String toString() {
        return getType() + "@" + location;
    }
}
