package scadflow.runtime.interpreter;

/**
 * 作用域句柄
 *
 * <p>只是 {@link ScopeManager} 中作用域记录的下标，不持有变量本身；
 * 管理器重置后旧句柄失效。</p>
 */
public final class VariableScope {
    private final int index;
    private final String scopeId;
    private final int generation;

    VariableScope(int index, String scopeId, int generation) {
        this.index = index;
        this.scopeId = scopeId;
        this.generation = generation;
    }

    int getIndex() {
        return index;
    }

    int getGeneration() {
        return generation;
    }

    public String getScopeId() {
        return scopeId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableScope)) return false;
        VariableScope other = (VariableScope) o;
        return index == other.index && generation == other.generation;
    }

    @Override
    public int hashCode() {
        return index * 31 + generation;
    }

    @Override
    public String toString() {
        return "Scope(" + scopeId + "#" + index + ")";
    }
}
