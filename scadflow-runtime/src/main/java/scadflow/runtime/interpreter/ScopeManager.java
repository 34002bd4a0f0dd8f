package scadflow.runtime.interpreter;

import scadflow.runtime.ScadException;
import scadflow.runtime.ScadUndef;
import scadflow.runtime.ScadValue;
import scadflow.runtime.module.ProcessedModuleDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 层级作用域管理（以下标寻址的作用域记录表）
 *
 * <p>每个作用域记录保存父记录下标，父子关系在创建时确定，因此只能形成树。
 * 子作用域只读访问父作用域，写操作只作用于给定作用域本身。
 * 每次流水线运行使用独立实例。</p>
 *
 * <p>展开过程中不逐个释放作用域：作用域在一次运行内可能被之后的 children() 与模块体再次引用，
 * 运行结束（成功或失败）时由集成流水线调用 {@link #reset()} 一次性释放。
 * {@link #cleanupScope} 供需要提前释放单个作用域的调用方使用。</p>
 */
public final class ScopeManager {

    private final List<ScopeRecord> arena = new ArrayList<>();
    private int generation;

    public VariableScope createScope(String scopeId, VariableScope parent) {
        int parentIndex = -1;
        if (parent != null) {
            record(parent);
            parentIndex = parent.getIndex();
        }
        int index = arena.size();
        arena.add(new ScopeRecord(scopeId, parentIndex));
        return new VariableScope(index, scopeId, generation);
    }

    public VariableScope createScope(String scopeId) {
        return createScope(scopeId, null);
    }

    /** 父作用域，根作用域返回 null */
    public VariableScope getParent(VariableScope scope) {
        ScopeRecord r = record(scope);
        if (r.parentIndex < 0) return null;
        ScopeRecord parent = arena.get(r.parentIndex);
        return new VariableScope(r.parentIndex, parent.scopeId, generation);
    }

    /**
     * 在给定作用域中绑定变量，同名绑定被覆盖
     */
    public void setVariable(VariableScope scope, String name, ScadValue value) {
        ScopeRecord r = record(scope);
        if (r.released) {
            throw new ScadException("Scope " + scope.getScopeId() + " has been cleaned up");
        }
        r.variables.put(name, value != null ? value : ScadUndef.UNDEF);
    }

    /**
     * 沿作用域链查找变量
     *
     * @return 变量值；找不到返回 null，不抛异常
     */
    public ScadValue getVariable(VariableScope scope, String name) {
        record(scope);
        int index = scope.getIndex();
        while (index >= 0) {
            ScopeRecord r = arena.get(index);
            ScadValue value = r.variables.get(name);
            if (value != null) {
                return value;
            }
            index = r.parentIndex;
        }
        return null;
    }

    public boolean hasLocalVariable(VariableScope scope, String name) {
        return record(scope).variables.containsKey(name);
    }

    /** 本作用域自身的绑定（只读，按定义顺序） */
    public Map<String, ScadValue> getLocalVariables(VariableScope scope) {
        return Collections.unmodifiableMap(record(scope).variables);
    }

    /**
     * 清空作用域的绑定并标记为已释放
     */
    public void cleanupScope(VariableScope scope) {
        ScopeRecord r = record(scope);
        r.variables.clear();
        r.modules.clear();
        r.released = true;
    }

    public boolean isCleanedUp(VariableScope scope) {
        return record(scope).released;
    }

    /** 在给定作用域中登记模块定义 */
    public void defineModule(VariableScope scope, ProcessedModuleDefinition definition) {
        ScopeRecord r = record(scope);
        if (r.released) {
            throw new ScadException("Scope " + scope.getScopeId() + " has been cleaned up");
        }
        r.modules.put(definition.getModuleName(), definition);
    }

    /**
     * 沿作用域链查找模块定义
     *
     * @return 定义及其所在作用域；找不到返回 null
     */
    public ResolvedModule findModule(VariableScope scope, String name) {
        record(scope);
        int index = scope.getIndex();
        while (index >= 0) {
            ScopeRecord r = arena.get(index);
            ProcessedModuleDefinition def = r.modules.get(name);
            if (def != null) {
                return new ResolvedModule(def, new VariableScope(index, r.scopeId, generation));
            }
            index = r.parentIndex;
        }
        return null;
    }

    /** 以给定作用域为起点的查找视图 */
    public VariableLookup lookup(VariableScope scope) {
        record(scope);
        return name -> getVariable(scope, name);
    }

    public int getScopeCount() {
        return arena.size();
    }

    public int getLiveScopeCount() {
        int live = 0;
        for (ScopeRecord r : arena) {
            if (!r.released) live++;
        }
        return live;
    }

    /**
     * 释放全部作用域，已发出的句柄随之失效
     */
    public void reset() {
        arena.clear();
        generation++;
    }

    private ScopeRecord record(VariableScope scope) {
        if (scope == null) {
            throw new ScadException("Scope must not be null");
        }
        if (scope.getGeneration() != generation || scope.getIndex() >= arena.size()) {
            throw new ScadException("Stale scope handle: " + scope.getScopeId());
        }
        return arena.get(scope.getIndex());
    }

    private static final class ScopeRecord {
        final String scopeId;
        final int parentIndex;
        final Map<String, ScadValue> variables = new LinkedHashMap<>();
        final Map<String, ProcessedModuleDefinition> modules = new LinkedHashMap<>();
        boolean released;

        ScopeRecord(String scopeId, int parentIndex) {
            this.scopeId = scopeId;
            this.parentIndex = parentIndex;
        }
    }
}
