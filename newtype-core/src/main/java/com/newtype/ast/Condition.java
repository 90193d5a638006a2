package com.newtype.ast;

import java.util.Objects;

/**
 * The test of a compound conditional. {@code not} binds tightest, then {@code and},
 * then {@code or}.
 */
public sealed interface Condition extends Node {

    /** {@code lhs op rhs} */
    record Comparison(Expression lhs, ComparisonOperator op, Expression rhs) implements Condition {
        public Comparison {
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(rhs, "rhs");
        }
    }

    record Not(Condition condition) implements Condition {
        public Not {
            Objects.requireNonNull(condition, "condition");
        }
    }

    record And(Condition left, Condition right) implements Condition {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Or(Condition left, Condition right) implements Condition {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }
}
