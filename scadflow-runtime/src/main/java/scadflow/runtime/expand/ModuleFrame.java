package scadflow.runtime.expand;

import com.scadflow.compiler.ast.stmt.Statement;
import scadflow.runtime.interpreter.VariableScope;

import java.util.List;

/**
 * 模块调用帧
 *
 * <p>保存调用点的子语句及其所在作用域，供模块体内的 children() 展开。</p>
 */
public final class ModuleFrame {
    private final String moduleName;
    private final List<Statement> callChildren;
    private final VariableScope callerScope;
    private final ModuleFrame callerFrame;
    private final int depth;

    public ModuleFrame(String moduleName, List<Statement> callChildren, VariableScope callerScope,
                       ModuleFrame callerFrame, int depth) {
        this.moduleName = moduleName;
        this.callChildren = callChildren;
        this.callerScope = callerScope;
        this.callerFrame = callerFrame;
        this.depth = depth;
    }

    public String getModuleName() {
        return moduleName;
    }

    public List<Statement> getCallChildren() {
        return callChildren;
    }

    public VariableScope getCallerScope() {
        return callerScope;
    }

    /** 调用方所在的帧，顶层调用为 null */
    public ModuleFrame getCallerFrame() {
        return callerFrame;
    }

    public int getDepth() {
        return depth;
    }
}
