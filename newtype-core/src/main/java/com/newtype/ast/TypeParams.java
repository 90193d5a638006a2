package com.newtype.ast;

import java.util.List;

/**
 * Generic parameter names of a type or interface definition, in declaration order.
 */
public record TypeParams(List<String> names) implements Node {
    public TypeParams {
        names = List.copyOf(names);
    }
}
