package com.calcroom.parser;

import com.calcroom.model.CalculatorError;
import com.calcroom.model.CalculatorException;
import com.calcroom.model.Expr;
import com.calcroom.model.Operator;

import java.util.List;

import static com.calcroom.parser.Token.Type.*;

/**
 * Recursive descent over infix tokens.
 * <pre>
 * expression := term (('+'|'-') term)*
 * term       := factor (('*'|'/') factor)*
 * factor     := NUMBER | VARIABLE | '(' expression ')'
 * </pre>
 */
public class ExprParser {

    private final List<Token> tokens;
    private int p = 0;
    private int depth = 0;

    public ExprParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /** Parses the whole token list; anything left after the expression is an error. */
    public static Expr parse(List<Token> tokens) {
        if (tokens.isEmpty()) {
            throw new CalculatorException(CalculatorError.EMPTY_EXPRESSION);
        }
        ExprParser parser = new ExprParser(tokens);
        Expr expr = parser.parseExpression();

        if (!parser.atEnd()) {
            Token extra = parser.current();
            if (extra.type() == RPAREN) {
                throw new CalculatorException(CalculatorError.UNMATCHED_RIGHT_PARENTHESIS,
                        "Unmatched ')' at pos " + extra.pos());
            }
            throw new CalculatorException(CalculatorError.EXTRA_TOKENS_DETECTED,
                    "Unexpected " + extra.type() + " '" + extra.text() + "' at pos " + extra.pos());
        }
        return expr;
    }

    public Expr parseExpression() {
        Expr left = parseTerm();
        while (peek(PLUS) || peek(MINUS)) {
            Operator op = tokens.get(p++).operator();
            left = new Expr.BinOp(left, op, parseTerm());
        }
        return left;
    }

    /** Tokens not consumed by the last {@link #parseExpression()} call. */
    public List<Token> remaining() {
        return tokens.subList(Math.min(p, tokens.size()), tokens.size());
    }

    private Expr parseTerm() {
        Expr left = parseFactor();
        while (peek(STAR) || peek(SLASH)) {
            Operator op = tokens.get(p++).operator();
            left = new Expr.BinOp(left, op, parseFactor());
        }
        return left;
    }

    private Expr parseFactor() {
        if (atEnd()) {
            throw new CalculatorException(CalculatorError.PARSE_ERROR, "Expected a number, variable or '(' at end of input");
        }
        if (peek(NUMBER)) return new Expr.Num(expect(NUMBER).number());
        if (peek(VARIABLE)) return new Expr.Var(expect(VARIABLE).text());
        if (peek(LPAREN)) return parseGroup();

        Token t = current();
        if (t.type() == RPAREN && depth == 0) {
            throw new CalculatorException(CalculatorError.UNMATCHED_RIGHT_PARENTHESIS, "Unmatched ')' at pos " + t.pos());
        }
        if (t.type() == FUNCTION) {
            throw new CalculatorException(CalculatorError.UNEXPECTED_TOKEN, "Unexpanded function '" + t.text() + "' at pos " + t.pos());
        }
        throw new CalculatorException(CalculatorError.PARSE_ERROR,
                "Expected a number, variable or '(' but got '" + t.text() + "' at pos " + t.pos());
    }

    private Expr parseGroup() {
        Token open = expect(LPAREN);
        depth++;
        Expr inner = parseExpression();
        if (atEnd()) {
            throw new CalculatorException(CalculatorError.UNMATCHED_LEFT_PARENTHESIS, "Unclosed '(' at pos " + open.pos());
        }
        expect(RPAREN);
        depth--;
        return inner;
    }

    private Token expect(Token.Type type) {
        Token t = current();
        if (t.type() != type) {
            throw new CalculatorException(CalculatorError.PARSE_ERROR,
                    "Expected " + type + " but got " + t.type() + " at pos " + t.pos());
        }
        p++;
        return t;
    }

    private boolean peek(Token.Type type) {
        return !atEnd() && current().type() == type;
    }

    private boolean atEnd() {
        return p >= tokens.size();
    }

    private Token current() {
        return tokens.get(Math.min(p, tokens.size() - 1));
    }
}
