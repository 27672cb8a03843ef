package com.calcroom.model;

public enum CalculatorError {
    DIVISION_BY_ZERO("Division by zero"),
    PARSE_ERROR("Could not parse expression"),
    UNEXPECTED_TOKEN("Unexpected token"),
    INVALID_EXPRESSION("Invalid expression"),
    MULTIPLE_VARIABLES("More than one variable"),
    EMPTY_EXPRESSION("Empty expression"),
    EXTRA_TOKENS_DETECTED("Extra tokens after expression"),
    UNMATCHED_RIGHT_PARENTHESIS("Unmatched right parenthesis"),
    UNMATCHED_LEFT_PARENTHESIS("Unmatched left parenthesis");

    private final String description;

    CalculatorError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
