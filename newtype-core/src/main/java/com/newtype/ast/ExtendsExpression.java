package com.newtype.ast;

import java.util.Objects;

/**
 * A structural-subtype conditional: {@code if [not] lhs op rhs then ifBody else elseBody}.
 *
 * <p>{@code negate} is kept as parsed. The printer swaps the branches when it is set,
 * so the original comparison direction stays visible to any pass that runs before it.</p>
 */
public record ExtendsExpression(
    Expression lhs,
    boolean negate,
    ComparisonOperator op,
    Expression rhs,
    Expression ifBody,
    Expression elseBody
) implements Expression {
    public ExtendsExpression {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(rhs, "rhs");
        Objects.requireNonNull(ifBody, "ifBody");
        Objects.requireNonNull(elseBody, "elseBody");
    }

    /** {@code lhs extends rhs ? ifBody : elseBody} */
    public static ExtendsExpression extendsLeft(Expression lhs, Expression rhs, Expression ifBody, Expression elseBody) {
        return new ExtendsExpression(lhs, false, ComparisonOperator.EXTENDS_LEFT, rhs, ifBody, elseBody);
    }
}
