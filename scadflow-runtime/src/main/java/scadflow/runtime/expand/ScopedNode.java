package scadflow.runtime.expand;

import com.scadflow.compiler.ast.StatementModifier;
import com.scadflow.compiler.ast.stmt.Statement;
import scadflow.runtime.interpreter.VariableScope;

import java.util.Collections;
import java.util.List;

/**
 * 展开树中的节点：语句、其所属作用域与模块帧
 *
 * <p>只有内置几何调用带有已进入的子节点；控制流与模块调用的子语句在对应的展开轮次中才进入。</p>
 */
public final class ScopedNode {
    private final Statement node;
    private final VariableScope scope;
    private final ModuleFrame frame;
    private final StatementModifier modifier;
    private final List<ScopedNode> children;

    public ScopedNode(Statement node, VariableScope scope, ModuleFrame frame,
                      StatementModifier modifier, List<ScopedNode> children) {
        this.node = node;
        this.scope = scope;
        this.frame = frame;
        this.modifier = modifier;
        this.children = Collections.unmodifiableList(children);
    }

    public Statement getNode() {
        return node;
    }

    public String getType() {
        return node.getType();
    }

    public VariableScope getScope() {
        return scope;
    }

    /** 顶层节点为 null */
    public ModuleFrame getFrame() {
        return frame;
    }

    /** 生效的修饰符：节点自身的，或从外层模块调用继承的；可能为 null */
    public StatementModifier getModifier() {
        return modifier;
    }

    public List<ScopedNode> getChildren() {
        return children;
    }

    public ScopedNode withChildren(List<ScopedNode> newChildren) {
        return new ScopedNode(node, scope, frame, modifier, newChildren);
    }

    @Override
    public String toString() {
        return "ScopedNode{" + node.getType() + " @" + scope.getScopeId() + ", children=" + children.size() + "}";
    }
}
