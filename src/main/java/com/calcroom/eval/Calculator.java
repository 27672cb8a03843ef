package com.calcroom.eval;

import com.calcroom.model.CalculatorError;
import com.calcroom.model.CalculatorException;
import com.calcroom.parser.ExprParser;
import com.calcroom.parser.FunctionExpander;
import com.calcroom.parser.Token;
import com.calcroom.parser.TokenClassifier;
import com.calcroom.parser.Tokenizer;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Entry point: evaluates one line of input and renders the answer.
 * Stateless; safe to call from any thread.
 */
public final class Calculator {

    static final double ROUNDING_SCALE = 100_000_000.0;

    private Calculator() {}

    /**
     * Returns the rounded value ({@code "14"}), or {@code "x=0.25"} when the input is an
     * equation in one unknown.
     *
     * @throws CalculatorException with the first failure met
     */
    public static String processExpression(String input) {
        List<Token> raw = new Tokenizer(input).tokenize();
        if (raw.isEmpty()) {
            throw new CalculatorException(CalculatorError.EMPTY_EXPRESSION);
        }

        // before expansion, which evaluates function arguments
        Optional<String> variable = TokenClassifier.variable(raw);

        List<Token> tokens = FunctionExpander.expand(raw);
        boolean equation = TokenClassifier.containsEquals(tokens);

        if (variable.isPresent() && equation) {
            double root = EquationSolver.solve(tokens);
            return variable.get() + "=" + format(round(root));
        }

        double result = TokenClassifier.isPostfix(tokens)
                ? Evaluator.evaluatePostfix(tokens)
                : Evaluator.evaluateInfix(ExprParser.parse(tokens));
        return format(round(result));
    }

    /** Rounds half away from zero to 8 decimal places. */
    public static double round(double value) {
        double scaled = value * ROUNDING_SCALE;
        double rounded = Math.signum(scaled) * Math.floor(Math.abs(scaled) + 0.5);
        return rounded / ROUNDING_SCALE + 0.0;
    }

    static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new CalculatorException(CalculatorError.INVALID_EXPRESSION, "Result is not a finite number");
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
