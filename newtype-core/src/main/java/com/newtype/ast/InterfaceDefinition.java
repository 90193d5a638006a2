package com.newtype.ast;

import java.util.List;
import java.util.Objects;

public record InterfaceDefinition(
    String name,
    TypeParams params,          // Can be null
    List<Expression> extendsList,
    List<KeyValue> props
) implements Statement {
    public InterfaceDefinition {
        Objects.requireNonNull(name, "name");
        extendsList = List.copyOf(extendsList);
        props = List.copyOf(props);
    }
}
