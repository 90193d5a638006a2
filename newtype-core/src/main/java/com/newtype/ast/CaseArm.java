package com.newtype.ast;

import java.util.Objects;

public record CaseArm(Expression pattern, Expression body) implements Node {
    public CaseArm {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(body, "body");
    }
}
