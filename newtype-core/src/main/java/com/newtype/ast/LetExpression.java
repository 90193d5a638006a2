package com.newtype.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code let X = a, Y = b in body}. Each binding sees the ones before it; the body
 * sees all of them. Surface syntax only: desugaring substitutes the bound names.
 */
public record LetExpression(List<LetBinding> bindings, Expression body) implements Expression {
    public LetExpression {
        bindings = List.copyOf(bindings);
        Objects.requireNonNull(body, "body");
        if (bindings.isEmpty()) {
            throw new IllegalArgumentException("let expression needs at least one binding");
        }
    }
}
