package com.newtype.ast;

import java.util.List;
import java.util.Objects;

/**
 * Multi-arm dispatch on a scrutinee. Surface syntax only: the desugaring pass
 * turns it into nested {@link ExtendsExpression}s before anything is rendered.
 */
public record CaseStatement(Expression scrutinee, List<CaseArm> arms) implements Expression {
    public CaseStatement {
        Objects.requireNonNull(scrutinee, "scrutinee");
        arms = List.copyOf(arms);
        if (arms.isEmpty()) {
            throw new IllegalArgumentException("case expression needs at least one arm");
        }
    }
}
