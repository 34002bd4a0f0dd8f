package scadflow.runtime.interpreter;

import scadflow.runtime.module.ProcessedModuleDefinition;

/**
 * 作用域链上找到的模块定义及其定义所在作用域
 */
public final class ResolvedModule {
    private final ProcessedModuleDefinition definition;
    private final VariableScope definitionScope;

    public ResolvedModule(ProcessedModuleDefinition definition, VariableScope definitionScope) {
        this.definition = definition;
        this.definitionScope = definitionScope;
    }

    public ProcessedModuleDefinition getDefinition() {
        return definition;
    }

    /** 调用帧的父作用域（词法作用域） */
    public VariableScope getDefinitionScope() {
        return definitionScope;
    }
}
