package com.scadflow.compiler.parser;

import com.scadflow.compiler.ast.Argument;
import com.scadflow.compiler.ast.expr.*;
import com.scadflow.compiler.lexer.Token;
import com.scadflow.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.scadflow.compiler.lexer.TokenType.*;

/**
 * 表达式解析（优先级爬升，每层一个方法）
 */
class ExprParser {

    private final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        parser.enterNesting();
        try {
            return parseTernary();
        } finally {
            parser.exitNesting();
        }
    }

    // 条件 ?:
    private Expression parseTernary() {
        Token start = parser.current;
        Expression condition = parseOr();
        if (parser.match(QUESTION)) {
            Expression thenExpr = parseExpression();
            parser.expect(COLON, "':'");
            Expression elseExpr = parseExpression();
            return new TernaryExpr(parser.locationFrom(start), condition, thenExpr, elseExpr);
        }
        return condition;
    }

    // 逻辑或 ||
    private Expression parseOr() {
        Token start = parser.current;
        Expression left = parseAnd();
        while (parser.check(OR)) {
            String op = parser.advance().getLexeme();
            Expression right = parseAnd();
            left = new BinaryExpr(parser.locationFrom(start), left, op, right);
        }
        return left;
    }

    // 逻辑与 &&
    private Expression parseAnd() {
        Token start = parser.current;
        Expression left = parseEquality();
        while (parser.check(AND)) {
            String op = parser.advance().getLexeme();
            Expression right = parseEquality();
            left = new BinaryExpr(parser.locationFrom(start), left, op, right);
        }
        return left;
    }

    // 相等 == !=
    private Expression parseEquality() {
        Token start = parser.current;
        Expression left = parseComparison();
        while (parser.checkAny(EQ, NE)) {
            String op = parser.advance().getLexeme();
            Expression right = parseComparison();
            left = new BinaryExpr(parser.locationFrom(start), left, op, right);
        }
        return left;
    }

    // 比较 < > <= >=
    private Expression parseComparison() {
        Token start = parser.current;
        Expression left = parseAdditive();
        while (parser.checkAny(LT, GT, LE, GE)) {
            String op = parser.advance().getLexeme();
            Expression right = parseAdditive();
            left = new BinaryExpr(parser.locationFrom(start), left, op, right);
        }
        return left;
    }

    // 加减 + -
    private Expression parseAdditive() {
        Token start = parser.current;
        Expression left = parseMultiplicative();
        while (parser.checkAny(PLUS, MINUS)) {
            String op = parser.advance().getLexeme();
            Expression right = parseMultiplicative();
            left = new BinaryExpr(parser.locationFrom(start), left, op, right);
        }
        return left;
    }

    // 乘除模 * / %
    private Expression parseMultiplicative() {
        Token start = parser.current;
        Expression left = parseUnary();
        while (parser.checkAny(STAR, SLASH, PERCENT)) {
            String op = parser.advance().getLexeme();
            Expression right = parseUnary();
            left = new BinaryExpr(parser.locationFrom(start), left, op, right);
        }
        return left;
    }

    // 一元 - + !
    private Expression parseUnary() {
        if (parser.checkAny(MINUS, PLUS, NOT)) {
            Token op = parser.advance();
            parser.enterNesting();
            try {
                Expression operand = parseUnary();
                return new UnaryExpr(parser.locationFrom(op), op.getLexeme(), operand);
            } finally {
                parser.exitNesting();
            }
        }
        return parsePostfix();
    }

    // 后缀 [i] .x
    private Expression parsePostfix() {
        Token start = parser.current;
        Expression expr = parsePrimary();
        while (true) {
            if (parser.match(LBRACKET)) {
                Expression index = parseExpression();
                parser.expect(RBRACKET, "']'");
                expr = new IndexExpr(parser.locationFrom(start), expr, index);
            } else if (parser.match(DOT)) {
                Token member = parser.expect(IDENTIFIER, "member name");
                expr = new MemberExpr(parser.locationFrom(start), expr, member.getLexeme());
            } else {
                break;
            }
        }
        return expr;
    }

    private Expression parsePrimary() {
        Token token = parser.current;
        TokenType type = token.getType();

        switch (type) {
            case NUMBER_LITERAL:
                parser.advance();
                return LiteralExpr.number(parser.locationFrom(token), (Double) token.getLiteral());
            case STRING_LITERAL:
                parser.advance();
                return LiteralExpr.string(parser.locationFrom(token), (String) token.getLiteral());
            case KW_TRUE:
                parser.advance();
                return LiteralExpr.bool(parser.locationFrom(token), true);
            case KW_FALSE:
                parser.advance();
                return LiteralExpr.bool(parser.locationFrom(token), false);
            case KW_UNDEF:
                parser.advance();
                return LiteralExpr.undef(parser.locationFrom(token));
            case IDENTIFIER:
                parser.advance();
                if (parser.check(LPAREN)) {
                    List<Argument> args = parseArguments();
                    return new CallExpr(parser.locationFrom(token), token.getLexeme(), args);
                }
                return new IdentifierExpr(parser.locationFrom(token), token.getLexeme());
            case LPAREN: {
                parser.advance();
                Expression inner = parseExpression();
                parser.expect(RPAREN, "')'");
                return inner;
            }
            case LBRACKET:
                return parseVectorOrRange();
            default:
                throw parser.error("Expected expression", "expression");
        }
    }

    // [a, b, c] | [start:end] | [start:step:end]
    private Expression parseVectorOrRange() {
        Token start = parser.advance();
        List<Expression> elements = new ArrayList<>();
        if (parser.match(RBRACKET)) {
            return new VectorExpr(parser.locationFrom(start), elements);
        }
        Expression first = parseExpression();
        if (parser.match(COLON)) {
            Expression second = parseExpression();
            Expression third = null;
            if (parser.match(COLON)) {
                third = parseExpression();
            }
            parser.expect(RBRACKET, "']'");
            if (third == null) {
                return new RangeExpr(parser.locationFrom(start), first, null, second);
            }
            return new RangeExpr(parser.locationFrom(start), first, second, third);
        }
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACKET)) break;  // 允许尾逗号
            elements.add(parseExpression());
        }
        parser.expect(RBRACKET, "']'");
        return new VectorExpr(parser.locationFrom(start), elements);
    }

    /**
     * 参数列表 (a, b, name = c)
     */
    List<Argument> parseArguments() {
        parser.expect(LPAREN, "'('");
        List<Argument> args = new ArrayList<>();
        while (!parser.check(RPAREN)) {
            if (parser.check(IDENTIFIER) && parser.peek(1).is(ASSIGN)) {
                String name = parser.advance().getLexeme();
                parser.advance(); // =
                args.add(new Argument(name, parseExpression()));
            } else {
                args.add(Argument.positional(parseExpression()));
            }
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RPAREN, "')'");
        return args;
    }
}
