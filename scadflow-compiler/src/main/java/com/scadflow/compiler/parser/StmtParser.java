package com.scadflow.compiler.parser;

import com.scadflow.compiler.ast.Argument;
import com.scadflow.compiler.ast.Binding;
import com.scadflow.compiler.ast.NodeCategory;
import com.scadflow.compiler.ast.ParameterDecl;
import com.scadflow.compiler.ast.StatementModifier;
import com.scadflow.compiler.ast.expr.Expression;
import com.scadflow.compiler.ast.stmt.*;
import com.scadflow.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.scadflow.compiler.lexer.TokenType.*;

/**
 * 语句解析
 */
class StmtParser {

    /** 按内置调用解析的非几何语句名 */
    private static final Set<String> BUILTIN_STATEMENTS = new HashSet<>();

    static {
        BUILTIN_STATEMENTS.add("children");
        BUILTIN_STATEMENTS.add("echo");
    }

    private final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析一条语句，结果追加到 out；块语句的内容直接展开
     *
     * @param modifier 外层修饰符，可为 null
     */
    void parseStatement(List<Statement> out, StatementModifier modifier) {
        parser.enterNesting();
        try {
            parseNested(out, modifier);
        } finally {
            parser.exitNesting();
        }
    }

    private void parseNested(List<Statement> out, StatementModifier modifier) {
        Token start = parser.current;

        // 空语句
        if (parser.match(SEMICOLON)) {
            return;
        }

        // 块
        if (parser.match(LBRACE)) {
            while (!parser.check(RBRACE)) {
                if (parser.isAtEnd()) {
                    throw parser.error("Unterminated block", "'}'");
                }
                parseStatement(out, modifier);
            }
            parser.advance();
            return;
        }

        // 修饰符 ! # % *
        if (parser.checkAny(NOT, HASH, PERCENT, STAR)) {
            Token modToken = parser.advance();
            StatementModifier m = StatementModifier.fromSymbol(modToken.getLexeme().charAt(0));
            parseStatement(out, mergeModifier(modifier, m));
            return;
        }

        switch (parser.current.getType()) {
            case KW_MODULE:
                out.add(parseModuleDefinition());
                return;
            case KW_FUNCTION:
                throw parser.error("User-defined functions are not supported");
            case KW_IF:
                out.add(parseIf(start));
                return;
            case KW_FOR:
                out.add(parseFor(start));
                return;
            case KW_LET:
                out.add(parseLet(start));
                return;
            case IDENTIFIER:
                if (parser.peek(1).is(ASSIGN)) {
                    out.add(parseAssignment());
                } else if (parser.peek(1).is(LPAREN)) {
                    out.add(parseInstantiation(modifier));
                } else {
                    parser.advance();
                    throw parser.error("Expected '(' or '=' after identifier '" + start.getLexeme() + "'",
                            "'(' or '='");
                }
                return;
            default:
                throw parser.error("Unexpected token", "statement");
        }
    }

    /** 内层修饰符优先，但禁用（*）始终保留 */
    private StatementModifier mergeModifier(StatementModifier outer, StatementModifier inner) {
        if (outer == StatementModifier.DISABLE) return outer;
        return inner;
    }

    /** 子语句体：单条语句或块 */
    List<Statement> parseBody() {
        List<Statement> body = new ArrayList<>();
        parseStatement(body, null);
        return body;
    }

    // module name(a, b = 2) body
    private ModuleDefinitionNode parseModuleDefinition() {
        Token start = parser.advance();
        Token name = parser.expect(IDENTIFIER, "module name");
        parser.expect(LPAREN, "'('");
        List<ParameterDecl> params = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        while (!parser.check(RPAREN)) {
            Token paramName = parser.expect(IDENTIFIER, "parameter name");
            if (!seen.add(paramName.getLexeme())) {
                throw new ParseException("Duplicate parameter '" + paramName.getLexeme()
                        + "' in module '" + name.getLexeme() + "'", paramName);
            }
            Expression defaultValue = null;
            if (parser.match(ASSIGN)) {
                defaultValue = parser.exprParser.parseExpression();
            }
            params.add(new ParameterDecl(paramName.getLexeme(), defaultValue));
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RPAREN, "')'");
        List<Statement> body = parseBody();
        return new ModuleDefinitionNode(parser.locationFrom(start), name.getLexeme(), params, body);
    }

    // if (cond) stmt [else stmt]
    private IfNode parseIf(Token start) {
        parser.advance();
        parser.expect(LPAREN, "'('");
        Expression condition = parser.exprParser.parseExpression();
        parser.expect(RPAREN, "')'");
        List<Statement> thenBody = parseBody();
        List<Statement> elseBody = null;
        if (parser.match(KW_ELSE)) {
            elseBody = parseBody();
        }
        return new IfNode(parser.locationFrom(start), condition, thenBody, elseBody);
    }

    // for (i = [0:2], j = [1, 2]) stmt
    private ForNode parseFor(Token start) {
        parser.advance();
        List<Binding> bindings = parseBindings();
        List<Statement> body = parseBody();
        return new ForNode(parser.locationFrom(start), bindings, body);
    }

    // let (a = 1) stmt
    private LetNode parseLet(Token start) {
        parser.advance();
        List<Binding> bindings = parseBindings();
        List<Statement> body = parseBody();
        return new LetNode(parser.locationFrom(start), bindings, body);
    }

    private List<Binding> parseBindings() {
        parser.expect(LPAREN, "'('");
        List<Binding> bindings = new ArrayList<>();
        while (!parser.check(RPAREN)) {
            Token name = parser.expect(IDENTIFIER, "variable name");
            parser.expect(ASSIGN, "'='");
            bindings.add(new Binding(name.getLexeme(), parser.exprParser.parseExpression()));
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RPAREN, "')'");
        return bindings;
    }

    // name = expr;
    private AssignmentNode parseAssignment() {
        Token name = parser.advance();
        parser.advance(); // =
        Expression value = parser.exprParser.parseExpression();
        parser.expect(SEMICOLON, "';'");
        return new AssignmentNode(parser.locationFrom(name), name.getLexeme(), value);
    }

    // name(args) ; | name(args) child | name(args) { children }
    private Statement parseInstantiation(StatementModifier modifier) {
        Token name = parser.advance();
        List<Argument> arguments = parser.exprParser.parseArguments();
        List<Statement> children = new ArrayList<>();
        if (!parser.match(SEMICOLON)) {
            parseStatement(children, modifier == StatementModifier.DISABLE ? modifier : null);
        }
        String callee = name.getLexeme();
        if (NodeCategory.isBuiltinGeometry(callee) || BUILTIN_STATEMENTS.contains(callee)) {
            return new CallNode(parser.locationFrom(name), callee, arguments, children, modifier);
        }
        return new ModuleInstantiationNode(parser.locationFrom(name), callee, arguments, children, modifier);
    }
}
