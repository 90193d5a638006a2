package com.newtype.ast;

public sealed interface Expression extends Node permits
    StringLiteral,
    IntegerLiteral,
    DoubleLiteral,
    BooleanLiteral,
    ObjectLiteral,
    TypeApplication,
    Identifier,
    InferIdentifier,
    Tuple,
    ExtendsExpression,
    Union,
    Intersection,
    CaseStatement,
    CompoundConditional,
    LetExpression {
}
