package com.newtype.ast;

import java.math.BigInteger;
import java.util.Objects;

public record IntegerLiteral(BigInteger value) implements Expression {
    public IntegerLiteral {
        Objects.requireNonNull(value, "value");
    }

    public static IntegerLiteral of(long value) {
        return new IntegerLiteral(BigInteger.valueOf(value));
    }
}
