package com.newtype.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.newtype.ast.ExportStatement;
import com.newtype.ast.ImportDeclaration;
import com.newtype.ast.InterfaceDefinition;
import com.newtype.ast.TypeDefinition;

/**
 * Statements carry their variant in a {@code "type"} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ImportDeclaration.class, name = "ImportDeclaration"),
    @JsonSubTypes.Type(value = ExportStatement.class, name = "ExportStatement"),
    @JsonSubTypes.Type(value = TypeDefinition.class, name = "TypeDefinition"),
    @JsonSubTypes.Type(value = InterfaceDefinition.class, name = "InterfaceDefinition")
})
public interface StatementMixin {
}
