package com.newtype.ast;

import java.util.Objects;

public record Union(Expression left, Expression right) implements Expression {
    public Union {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
