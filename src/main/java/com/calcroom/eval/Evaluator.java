package com.calcroom.eval;

import com.calcroom.model.CalculatorError;
import com.calcroom.model.CalculatorException;
import com.calcroom.model.Expr;
import com.calcroom.parser.Token;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

public final class Evaluator {

    private Evaluator() {}

    public static double evaluateInfix(Expr expr) {
        if (expr instanceof Expr.Num n) return n.value();
        if (expr instanceof Expr.Var v) {
            throw new CalculatorException(CalculatorError.INVALID_EXPRESSION,
                    "Cannot evaluate unknown '" + v.name() + "' without an equation");
        }
        Expr.BinOp b = (Expr.BinOp) expr;
        double left = evaluateInfix(b.left());
        double right = evaluateInfix(b.right());
        return b.op().apply(left, right);
    }

    public static double evaluatePostfix(List<Token> tokens) {
        Deque<Double> stack = new ArrayDeque<>();

        for (Token t : tokens) {
            if (t.type() == Token.Type.NUMBER) {
                stack.push(t.number());
                continue;
            }
            if (!t.isOperator()) {
                throw new CalculatorException(CalculatorError.UNEXPECTED_TOKEN,
                        "Unexpected " + t.type() + " '" + t.text() + "' in postfix input at pos " + t.pos());
            }
            if (stack.size() < 2) {
                throw new CalculatorException(CalculatorError.INVALID_EXPRESSION,
                        "Operator '" + t.text() + "' at pos " + t.pos() + " needs two operands");
            }
            double right = stack.pop();
            double left = stack.pop();
            stack.push(t.operator().apply(left, right));
        }

        if (stack.size() != 1) {
            throw new CalculatorException(CalculatorError.INVALID_EXPRESSION,
                    "Postfix input left " + stack.size() + " values on the stack");
        }
        return stack.pop();
    }
}
