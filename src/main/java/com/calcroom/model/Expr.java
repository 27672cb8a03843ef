package com.calcroom.model;

public sealed interface Expr permits Expr.Num, Expr.Var, Expr.BinOp {

    record Num(double value) implements Expr {}

    record Var(String name) implements Expr {}

    record BinOp(Expr left, Operator op, Expr right) implements Expr {}
}
