package com.newtype.ast;

import java.util.Objects;

public record TypeDefinition(
    String name,
    TypeParams params,      // Can be null
    Expression body
) implements Statement {
    public TypeDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
    }

    public static TypeDefinition of(String name, Expression body) {
        return new TypeDefinition(name, null, body);
    }
}
