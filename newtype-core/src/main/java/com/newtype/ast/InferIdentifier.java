package com.newtype.ast;

import java.util.Objects;

/**
 * A binding introduced on the comparison side of a conditional, written {@code ?Name}.
 */
public record InferIdentifier(String name) implements Expression {
    public InferIdentifier {
        Objects.requireNonNull(name, "name");
    }
}
