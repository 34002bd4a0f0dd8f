package scadflow.runtime.integration;

import com.scadflow.compiler.ast.stmt.Statement;
import com.scadflow.compiler.parser.ParseException;
import scadflow.runtime.Result;

import java.util.List;

/**
 * 上游解析器：源码到根语句列表
 */
public interface SourceParser {

    Result<List<Statement>, ParseException> parse(String source);
}
