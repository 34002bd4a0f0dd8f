package scadflow.runtime.module;

import com.scadflow.compiler.ast.stmt.ModuleInstantiationNode;
import com.scadflow.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 处理后的模块调用（只规范化调用自身的实参，不合并被调模块的默认值）
 */
public final class ProcessedModuleCall {
    private final String moduleName;
    private final List<ModuleArgument> arguments;
    private final List<Statement> children;
    private final int depth;
    private final ModuleInstantiationNode originalNode;

    public ProcessedModuleCall(String moduleName, List<ModuleArgument> arguments, List<Statement> children,
                               int depth, ModuleInstantiationNode originalNode) {
        this.moduleName = moduleName;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        this.depth = depth;
        this.originalNode = originalNode;
    }

    public String getModuleName() {
        return moduleName;
    }

    /** 与调用书写顺序一致 */
    public List<ModuleArgument> getArguments() {
        return arguments;
    }

    public List<Statement> getChildren() {
        return children;
    }

    /** 嵌套调用深度，顶层调用为 1 */
    public int getDepth() {
        return depth;
    }

    public ModuleInstantiationNode getOriginalNode() {
        return originalNode;
    }
}
