package scadflow.runtime.expand;

import com.scadflow.compiler.ast.stmt.CallNode;
import com.scadflow.compiler.ast.stmt.ForNode;
import com.scadflow.compiler.ast.stmt.IfNode;
import com.scadflow.compiler.ast.stmt.LetNode;
import com.scadflow.compiler.ast.stmt.ModuleInstantiationNode;
import com.scadflow.compiler.ast.stmt.Statement;

/**
 * 待展开的构造种类，每种对应一个展开轮次
 */
public enum PendingKind {
    MODULE {
        @Override
        public boolean matches(Statement node) {
            return node instanceof ModuleInstantiationNode
                    || (node instanceof CallNode && TreeExpander.CHILDREN.equals(((CallNode) node).getName()));
        }
    },
    LOOP {
        @Override
        public boolean matches(Statement node) {
            return node instanceof ForNode || node instanceof LetNode;
        }
    },
    CONDITIONAL {
        @Override
        public boolean matches(Statement node) {
            return node instanceof IfNode;
        }
    };

    public abstract boolean matches(Statement node);
}
