package com.newtype.ast;

import java.util.Objects;

public record Intersection(Expression left, Expression right) implements Expression {
    public Intersection {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
