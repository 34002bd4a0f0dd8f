package scadflow.runtime.integration;

import com.scadflow.compiler.ast.stmt.Statement;
import com.scadflow.compiler.parser.ParseException;
import com.scadflow.compiler.parser.Parser;
import scadflow.runtime.Result;

import java.util.List;

/**
 * 基于 scadflow-compiler 词法与语法分析器的解析器
 */
public final class DefaultSourceParser implements SourceParser {

    private final String fileName;

    public DefaultSourceParser(String fileName) {
        this.fileName = fileName;
    }

    public DefaultSourceParser() {
        this("<input>");
    }

    @Override
    public Result<List<Statement>, ParseException> parse(String source) {
        try {
            return Result.ok(Parser.parse(source, fileName));
        } catch (ParseException e) {
            return Result.err(e);
        }
    }
}
