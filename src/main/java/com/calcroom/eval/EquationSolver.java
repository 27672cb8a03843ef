package com.calcroom.eval;

import com.calcroom.model.Affine;
import com.calcroom.model.CalculatorError;
import com.calcroom.model.CalculatorException;
import com.calcroom.model.Expr;
import com.calcroom.model.Operator;
import com.calcroom.parser.ExprParser;
import com.calcroom.parser.Token;

import java.util.List;

/**
 * Solves {@code left = right} for the single unknown, provided both sides are linear in it.
 */
public final class EquationSolver {

    private EquationSolver() {}

    public static double solve(List<Token> tokens) {
        int eq = -1;
        for (int k = 0; k < tokens.size(); k++) {
            if (tokens.get(k).type() == Token.Type.EQUALS) {
                eq = k;
                break;
            }
        }
        if (eq < 0) {
            throw new CalculatorException(CalculatorError.PARSE_ERROR, "Equation has no '='");
        }

        Affine left = reduce(ExprParser.parse(tokens.subList(0, eq)));
        Affine right = reduce(ExprParser.parse(tokens.subList(eq + 1, tokens.size())));

        double a = left.coefficient() - right.coefficient();
        double b = right.constant() - left.constant();

        // no solution and every-x-is-a-solution are not told apart
        if (a == 0.0) {
            throw new CalculatorException(CalculatorError.INVALID_EXPRESSION,
                    "Equation does not have a single solution");
        }
        return b / a;
    }

    public static Affine reduce(Expr expr) {
        if (expr instanceof Expr.Num n) return Affine.constant(n.value());
        if (expr instanceof Expr.Var) return Affine.unknown();

        Expr.BinOp b = (Expr.BinOp) expr;
        Affine left = reduce(b.left());
        Affine right = reduce(b.right());
        Operator op = b.op();

        switch (op) {
            case ADD:
                return left.plus(right);
            case SUB:
                return left.minus(right);
            case MUL:
                if (left.isConstant()) return right.scale(left.constant());
                if (right.isConstant()) return left.scale(right.constant());
                throw new CalculatorException(CalculatorError.INVALID_EXPRESSION,
                        "Product of two terms in the unknown is not linear");
            case DIV:
                if (!right.isConstant()) {
                    throw new CalculatorException(CalculatorError.INVALID_EXPRESSION,
                            "Dividing by the unknown is not linear");
                }
                if (right.constant() == 0.0) {
                    throw new CalculatorException(CalculatorError.DIVISION_BY_ZERO, "Division by zero in equation");
                }
                return left.divide(right.constant());
            default:
                throw new IllegalStateException("Unknown operator " + op);
        }
    }
}
