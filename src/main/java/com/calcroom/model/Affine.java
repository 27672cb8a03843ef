package com.calcroom.model;

/**
 * A value of the form {@code coefficient * x + constant} over the single unknown.
 */
public record Affine(double coefficient, double constant) {

    public static Affine constant(double value) {
        return new Affine(0.0, value);
    }

    public static Affine unknown() {
        return new Affine(1.0, 0.0);
    }

    public boolean isConstant() {
        return coefficient == 0.0;
    }

    public Affine plus(Affine other) {
        return new Affine(coefficient + other.coefficient, constant + other.constant);
    }

    public Affine minus(Affine other) {
        return new Affine(coefficient - other.coefficient, constant - other.constant);
    }

    public Affine scale(double factor) {
        return new Affine(coefficient * factor, constant * factor);
    }

    public Affine divide(double divisor) {
        return new Affine(coefficient / divisor, constant / divisor);
    }
}
