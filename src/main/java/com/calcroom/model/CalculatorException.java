package com.calcroom.model;

public class CalculatorException extends RuntimeException {

    private final CalculatorError error;

    public CalculatorException(CalculatorError error) {
        this(error, error.description());
    }

    public CalculatorException(CalculatorError error, String message) {
        super(message);
        this.error = error;
    }

    public CalculatorError error() {
        return error;
    }
}
