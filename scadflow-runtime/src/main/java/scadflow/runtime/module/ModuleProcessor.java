package scadflow.runtime.module;

import com.scadflow.compiler.ast.Argument;
import com.scadflow.compiler.ast.AstNode;
import com.scadflow.compiler.ast.ParameterDecl;
import com.scadflow.compiler.ast.stmt.ModuleDefinitionNode;
import com.scadflow.compiler.ast.stmt.ModuleInstantiationNode;
import scadflow.runtime.Result;
import scadflow.runtime.perf.PerformanceTracker;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 模块处理器
 *
 * <p>规范化模块定义（形参按声明顺序原样复制）与模块调用（实参按书写顺序原样复制），
 * 并按配置限制嵌套调用深度。实参到形参的绑定由展开阶段完成。</p>
 */
public final class ModuleProcessor {

    private final ModulePipelineConfiguration configuration;
    private final PerformanceTracker tracker;
    private int operationSeq;

    /**
     * @param tracker 可为 null（不追踪）
     */
    public ModuleProcessor(ModulePipelineConfiguration configuration, PerformanceTracker tracker) {
        this.configuration = configuration;
        this.tracker = tracker;
    }

    public ModuleProcessor() {
        this(ModulePipelineConfiguration.defaults(), null);
    }

    public ModulePipelineConfiguration getConfiguration() {
        return configuration;
    }

    public Result<ProcessedModuleDefinition, ModuleException> processModuleDefinition(AstNode node) {
        String name = node instanceof ModuleDefinitionNode ? ((ModuleDefinitionNode) node).getName() : null;
        try {
            return PerformanceTracker.track(tracker, nextOperation("module_definition", name), label(name),
                    () -> Result.<ProcessedModuleDefinition, ModuleException>ok(definition(node)));
        } catch (ModuleException e) {
            return Result.err(e);
        } catch (RuntimeException e) {
            return Result.err(new ModuleException("Failed to process module definition: " + e.getMessage(), name, e));
        }
    }

    public Result<ProcessedModuleCall, ModuleException> processModuleCall(AstNode node) {
        return processModuleCall(node, 1);
    }

    /**
     * @param depth 该调用的嵌套深度，超过 maxRecursionDepth 即失败
     */
    public Result<ProcessedModuleCall, ModuleException> processModuleCall(AstNode node, int depth) {
        String name = node instanceof ModuleInstantiationNode ? ((ModuleInstantiationNode) node).getName() : null;
        try {
            return PerformanceTracker.track(tracker, nextOperation("module_call", name), label(name),
                    () -> Result.<ProcessedModuleCall, ModuleException>ok(call(node, depth)));
        } catch (ModuleException e) {
            return Result.err(e);
        } catch (RuntimeException e) {
            return Result.err(new ModuleException("Failed to process module call: " + e.getMessage(), name, e));
        }
    }

    private ProcessedModuleDefinition definition(AstNode node) {
        if (configuration.isEnableValidation() && !isValidDefinition(node)) {
            throw new ModuleException("Invalid module definition structure", null);
        }
        ModuleDefinitionNode def = (ModuleDefinitionNode) node;
        List<ModuleParameter> parameters = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ParameterDecl p : def.getParameters()) {
            if (!seen.add(p.getName())) {
                throw new ModuleException("Duplicate parameter '" + p.getName() + "' in module '"
                        + def.getName() + "'", def.getName());
            }
            parameters.add(new ModuleParameter(p.getName(), p.getDefaultValue(), p.getTypeAnnotation()));
        }
        return new ProcessedModuleDefinition(def.getName(), parameters, def.getBody(), def);
    }

    private ProcessedModuleCall call(AstNode node, int depth) {
        if (configuration.isEnableValidation() && !isValidCall(node)) {
            throw new ModuleException("Invalid module call structure", null);
        }
        ModuleInstantiationNode inst = (ModuleInstantiationNode) node;
        if (depth > configuration.getMaxRecursionDepth()) {
            throw new ModuleException("Maximum recursion depth exceeded (" + configuration.getMaxRecursionDepth()
                    + ") while calling module '" + inst.getName() + "'", inst.getName());
        }
        List<ModuleArgument> arguments = new ArrayList<>();
        for (Argument arg : inst.getArguments()) {
            arguments.add(new ModuleArgument(arg.getName(), arg.getValue()));
        }
        return new ProcessedModuleCall(inst.getName(), arguments, inst.getChildren(), depth, inst);
    }

    private boolean isValidDefinition(AstNode node) {
        if (!(node instanceof ModuleDefinitionNode)) return false;
        ModuleDefinitionNode def = (ModuleDefinitionNode) node;
        return "module_definition".equals(def.getType())
                && def.getName() != null && !def.getName().isEmpty()
                && def.getBody() != null;
    }

    private boolean isValidCall(AstNode node) {
        if (!(node instanceof ModuleInstantiationNode)) return false;
        ModuleInstantiationNode inst = (ModuleInstantiationNode) node;
        return inst.getName() != null && !inst.getName().isEmpty();
    }

    private String nextOperation(String kind, String name) {
        return kind + "-" + label(name) + "-" + (++operationSeq);
    }

    private static String label(String name) {
        return name != null ? name : "<anonymous>";
    }
}
