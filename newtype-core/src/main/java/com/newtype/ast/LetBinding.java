package com.newtype.ast;

import java.util.Objects;

public record LetBinding(String name, Expression value) implements Node {
    public LetBinding {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
