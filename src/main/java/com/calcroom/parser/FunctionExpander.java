package com.calcroom.parser;

import com.calcroom.eval.Evaluator;
import com.calcroom.eval.MathFunction;
import com.calcroom.model.CalculatorError;
import com.calcroom.model.CalculatorException;

import java.util.ArrayList;
import java.util.List;

import static com.calcroom.parser.Token.Type.*;

/**
 * Replaces every FUNCTION token and its argument with the numeric result, so the parser
 * grammar never needs a call production.
 *
 * <p>The argument is either a parenthesized group ({@code cos(0)}), the single number or
 * function that follows ({@code sinpi}, {@code sinlog10}), or, for {@code logN} with nothing
 * after it, the base itself ({@code log10}).
 */
public final class FunctionExpander {

    private final List<Token> tokens;
    private int p = 0;

    private FunctionExpander(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static List<Token> expand(List<Token> tokens) {
        List<Token> out = new ArrayList<>();
        FunctionExpander expander = new FunctionExpander(tokens);
        while (expander.p < tokens.size()) {
            Token t = tokens.get(expander.p);
            if (t.type() == FUNCTION) {
                out.add(expander.applyFunction());
                continue;
            }
            out.add(t);
            expander.p++;
        }
        return List.copyOf(out);
    }

    private Token applyFunction() {
        Token fn = tokens.get(p++);
        MathFunction f = MathFunction.matchAt(fn.text(), 0);
        if (f == null) {
            throw new CalculatorException(CalculatorError.UNEXPECTED_TOKEN,
                    "Unknown function '" + fn.text() + "' at pos " + fn.pos());
        }
        String base = fn.text().substring(f.symbol().length());

        double arg = argument(fn, base);
        double value = base.isEmpty() ? f.apply(arg) : MathFunction.log(Double.parseDouble(base), arg);

        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new CalculatorException(CalculatorError.INVALID_EXPRESSION,
                    fn.text() + "(" + arg + ") is undefined at pos " + fn.pos());
        }
        return Token.number(value, fn.pos());
    }

    private double argument(Token fn, String base) {
        if (peek(LPAREN)) {
            int close = matchingParen(p);
            List<Token> inner = tokens.subList(p + 1, close);
            p = close + 1;
            return Evaluator.evaluateInfix(ExprParser.parse(expand(inner)));
        }
        if (peek(FUNCTION)) {
            return applyFunction().number();
        }
        if (peek(NUMBER)) {
            return tokens.get(p++).number();
        }
        if (!base.isEmpty()) {
            return Double.parseDouble(base);
        }
        throw new CalculatorException(CalculatorError.PARSE_ERROR,
                "Missing argument for " + fn.text() + " at pos " + fn.pos());
    }

    private int matchingParen(int open) {
        int depth = 0;
        for (int k = open; k < tokens.size(); k++) {
            Token.Type type = tokens.get(k).type();
            if (type == LPAREN) depth++;
            if (type == RPAREN) {
                depth--;
                if (depth == 0) return k;
            }
        }
        throw new CalculatorException(CalculatorError.UNMATCHED_LEFT_PARENTHESIS,
                "Unclosed '(' at pos " + tokens.get(open).pos());
    }

    private boolean peek(Token.Type type) {
        return p < tokens.size() && tokens.get(p).type() == type;
    }
}
