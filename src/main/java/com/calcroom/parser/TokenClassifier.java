package com.calcroom.parser;

import com.calcroom.model.CalculatorError;
import com.calcroom.model.CalculatorException;

import java.util.List;
import java.util.Optional;

import static com.calcroom.parser.Token.Type.*;

public final class TokenClassifier {

    private TokenClassifier() {}

    /**
     * Heuristic postfix check: true once an operator directly follows a number and leaves
     * exactly one more number than operators seen. Input with parentheses or '=' is never postfix.
     */
    public static boolean isPostfix(List<Token> tokens) {
        if (tokens.stream().anyMatch(t -> t.type() == LPAREN || t.type() == RPAREN || t.type() == EQUALS)) {
            return false;
        }

        boolean lastWasNumber = false;
        int numbers = 0;
        int operators = 0;

        for (Token t : tokens) {
            if (t.type() == NUMBER) {
                numbers++;
                lastWasNumber = true;
            } else if (t.isOperator()) {
                operators++;
                if (lastWasNumber && numbers - operators == 1) return true;
                lastWasNumber = false;
            } else {
                lastWasNumber = false;
            }
        }
        return false;
    }

    public static boolean containsEquals(List<Token> tokens) {
        return tokens.stream().anyMatch(t -> t.type() == EQUALS);
    }

    /** The single variable name used in the input, if any. */
    public static Optional<String> variable(List<Token> tokens) {
        String seen = null;
        for (Token t : tokens) {
            if (t.type() != VARIABLE) continue;
            if (seen == null) {
                seen = t.text();
            } else if (!seen.equals(t.text())) {
                throw new CalculatorException(CalculatorError.MULTIPLE_VARIABLES,
                        "Found '" + t.text() + "' at pos " + t.pos() + " after '" + seen + "'");
            }
        }
        return Optional.ofNullable(seen);
    }
}
