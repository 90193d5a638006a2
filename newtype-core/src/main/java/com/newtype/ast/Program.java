package com.newtype.ast;

import java.util.List;

public record Program(List<Statement> statements) implements Node {
    public Program {
        statements = List.copyOf(statements);
    }
}
