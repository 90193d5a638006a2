package com.newtype.ast;

import java.util.Objects;

/**
 * {@code if cond then ifBody else elseBody} where the condition combines comparisons
 * with {@code and}, {@code or} or a nested {@code not}. A single comparison parses to
 * {@link ExtendsExpression} instead. Surface syntax only: desugaring expands it into
 * nested {@link ExtendsExpression}s.
 */
public record CompoundConditional(Condition condition, Expression ifBody, Expression elseBody) implements Expression {
    public CompoundConditional {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(ifBody, "ifBody");
        Objects.requireNonNull(elseBody, "elseBody");
    }
}
