package com.calcroom.eval;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Named single-argument functions recognized inside expressions.
 * {@code log} takes an optional numeric base written right after its name ({@code log2}, {@code log100}).
 */
public enum MathFunction {
    SIN("sin", Math::sin),
    COS("cos", Math::cos),
    TAN("tan", Math::tan),
    LN("ln", Math::log),
    LOG("log", Math::log10),
    SQRT("sqrt", Math::sqrt),
    ABS("abs", Math::abs),
    EXP("exp", Math::exp);

    // longest names first so a prefix never shadows a longer name
    private static final List<MathFunction> BY_LENGTH = Arrays.stream(values())
            .sorted(Comparator.comparingInt((MathFunction f) -> f.symbol.length()).reversed())
            .toList();

    private final String symbol;
    private final DoubleUnaryOperator op;

    MathFunction(String symbol, DoubleUnaryOperator op) {
        this.symbol = symbol;
        this.op = op;
    }

    public String symbol() {
        return symbol;
    }

    public double apply(double x) {
        return op.applyAsDouble(x);
    }

    public static double log(double base, double x) {
        if (base == 10.0) return Math.log10(x);
        return Math.log(x) / Math.log(base);
    }

    /** The function whose name starts at {@code pos} in {@code s}, or null. */
    public static MathFunction matchAt(String s, int pos) {
        for (MathFunction f : BY_LENGTH) {
            if (s.startsWith(f.symbol, pos)) return f;
        }
        return null;
    }
}
