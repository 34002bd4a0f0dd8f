package scadflow.runtime.geometry;

import scadflow.runtime.Result;
import scadflow.runtime.expand.ScopedNode;
import scadflow.runtime.interpreter.InterpreterContext;

import java.util.List;

/**
 * 几何生成器：把展开后的树转换为几何节点
 */
public interface GeometryEmitter {

    Result<List<GeometryNode>, GenerationException> emit(List<ScopedNode> tree, InterpreterContext context);
}
