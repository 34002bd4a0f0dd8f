package scadflow.runtime.interpreter;

import com.scadflow.compiler.ast.stmt.Statement;
import scadflow.runtime.ScadValue;

import java.util.Collections;
import java.util.List;

/**
 * 条件处理结果
 */
public final class ConditionalResult {

    /**
     * 执行的分支
     */
    public enum Branch {
        THEN("then"),
        ELSE("else"),
        NONE("none");

        private final String label;

        Branch(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    private final boolean conditionResult;
    private final ScadValue conditionValue;
    private final Branch executedBranch;
    private final List<Statement> resultingNodes;
    private final double processingTimeMs;

    public ConditionalResult(boolean conditionResult, ScadValue conditionValue, Branch executedBranch,
                             List<Statement> resultingNodes, double processingTimeMs) {
        this.conditionResult = conditionResult;
        this.conditionValue = conditionValue;
        this.executedBranch = executedBranch;
        this.resultingNodes = Collections.unmodifiableList(resultingNodes);
        this.processingTimeMs = processingTimeMs;
    }

    public boolean getConditionResult() {
        return conditionResult;
    }

    /** 条件表达式求值得到的原始值 */
    public ScadValue getConditionValue() {
        return conditionValue;
    }

    public Branch getExecutedBranch() {
        return executedBranch;
    }

    /** 选中分支的语句，NONE 时为空 */
    public List<Statement> getResultingNodes() {
        return resultingNodes;
    }

    public double getProcessingTimeMs() {
        return processingTimeMs;
    }
}
