package com.newtype.ast;

import java.util.List;

public record Tuple(List<Expression> elements) implements Expression {
    public Tuple {
        elements = List.copyOf(elements);
    }

    public static Tuple of(Expression... elements) {
        return new Tuple(List.of(elements));
    }
}
