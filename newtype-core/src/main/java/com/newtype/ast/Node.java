package com.newtype.ast;

/**
 * Base interface for all Newtype AST nodes.
 *
 * Nodes are immutable records without source positions, so two programs that
 * differ only in layout produce equal trees.
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    ImportClause,
    ImportSpecifier,
    TypeParams,
    KeyValue,
    CaseArm,
    Condition,
    LetBinding {
}
