package com.calcroom.model;

public enum Operator {
    ADD('+'), SUB('-'), MUL('*'), DIV('/');

    private final char symbol;

    Operator(char symbol) {
        this.symbol = symbol;
    }

    /** Fails with DIVISION_BY_ZERO when dividing by exactly zero. */
    public double apply(double left, double right) {
        return switch (this) {
            case ADD -> left + right;
            case SUB -> left - right;
            case MUL -> left * right;
            case DIV -> {
                if (right == 0.0) throw new CalculatorException(CalculatorError.DIVISION_BY_ZERO,
                        "Division by zero: " + left + " " + symbol + " 0");
                yield left / right;
            }
        };
    }
}
