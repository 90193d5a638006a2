package com.newtype.ast;

import java.util.Objects;

public record Identifier(String name) implements Expression {
    private static final Identifier NEVER = new Identifier("never");

    public Identifier {
        Objects.requireNonNull(name, "name");
    }

    /** The bottom type, used as the implicit else branch of conditionals. */
    public static Identifier never() {
        return NEVER;
    }
}
