package com.newtype.ast;

public sealed interface Statement extends Node permits
    ImportDeclaration,
    ExportStatement,
    TypeDefinition,
    InterfaceDefinition {
}
