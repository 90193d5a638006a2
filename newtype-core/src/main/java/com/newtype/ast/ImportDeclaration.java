package com.newtype.ast;

import java.util.Objects;

public record ImportDeclaration(
    ImportClause importClause,
    String fromClause       // Module path, without quotes
) implements Statement {
    public ImportDeclaration {
        Objects.requireNonNull(importClause, "importClause");
        Objects.requireNonNull(fromClause, "fromClause");
    }
}
