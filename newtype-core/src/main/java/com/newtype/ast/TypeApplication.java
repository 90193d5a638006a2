package com.newtype.ast;

import java.util.List;
import java.util.Objects;

/**
 * Application of a named generic to its arguments. With no arguments it
 * renders as the bare name.
 */
public record TypeApplication(String name, List<Expression> args) implements Expression {
    public TypeApplication {
        Objects.requireNonNull(name, "name");
        args = List.copyOf(args);
    }

    public static TypeApplication of(String name, Expression... args) {
        return new TypeApplication(name, List.of(args));
    }
}
