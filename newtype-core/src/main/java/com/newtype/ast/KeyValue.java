package com.newtype.ast;

import java.util.Objects;

public record KeyValue(
    Modifier readonly,
    Modifier optional,
    String key,
    Expression value
) implements Node {
    public KeyValue {
        Objects.requireNonNull(readonly, "readonly");
        Objects.requireNonNull(optional, "optional");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public static KeyValue of(String key, Expression value) {
        return new KeyValue(Modifier.UNSET, Modifier.UNSET, key, value);
    }
}
