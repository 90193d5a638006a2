package com.newtype.ast;

import java.util.List;

public record ObjectLiteral(List<KeyValue> props) implements Expression {
    public ObjectLiteral {
        props = List.copyOf(props);
    }
}
