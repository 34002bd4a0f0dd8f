package scadflow.runtime.module;

import com.scadflow.compiler.ast.stmt.ModuleDefinitionNode;
import com.scadflow.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 处理后的模块定义
 */
public final class ProcessedModuleDefinition {
    private final String moduleName;
    private final List<ModuleParameter> parameters;
    private final List<Statement> body;
    private final ModuleDefinitionNode originalNode;

    public ProcessedModuleDefinition(String moduleName, List<ModuleParameter> parameters,
                                     List<Statement> body, ModuleDefinitionNode originalNode) {
        this.moduleName = moduleName;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
        this.originalNode = originalNode;
    }

    public String getModuleName() {
        return moduleName;
    }

    /** 与声明顺序一致 */
    public List<ModuleParameter> getParameters() {
        return parameters;
    }

    public List<Statement> getBody() {
        return body;
    }

    public ModuleDefinitionNode getOriginalNode() {
        return originalNode;
    }

    /** 形参下标，不存在返回 -1 */
    public int indexOfParameter(String name) {
        for (int i = 0; i < parameters.size(); i++) {
            if (parameters.get(i).getName().equals(name)) return i;
        }
        return -1;
    }
}
