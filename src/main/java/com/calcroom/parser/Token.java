package com.calcroom.parser;

import com.calcroom.model.Operator;

public record Token(Type type, String text, int pos) {
    public enum Type {
        NUMBER, VARIABLE,
        PLUS, MINUS, STAR, SLASH,
        LPAREN, RPAREN, EQUALS,
        // only between Tokenizer.tokenize() and FunctionExpander
        FUNCTION
    }

    public static Token number(double value, int pos) {
        return new Token(Type.NUMBER, Double.toString(value), pos);
    }

    public double number() {
        return Double.parseDouble(text);
    }

    public boolean isOperator() {
        return type == Type.PLUS || type == Type.MINUS || type == Type.STAR || type == Type.SLASH;
    }

    public Operator operator() {
        switch (type) {
            case PLUS: return Operator.ADD;
            case MINUS: return Operator.SUB;
            case STAR: return Operator.MUL;
            case SLASH: return Operator.DIV;
            default: throw new IllegalStateException("Not an operator: " + type + " at pos " + pos);
        }
    }
}
