package com.newtype.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.newtype.ast.ImportSpecifier;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ImportSpecifier.Binding.class, name = "ImportedBinding"),
    @JsonSubTypes.Type(value = ImportSpecifier.Alias.class, name = "ImportedAlias")
})
public interface ImportSpecifierMixin {
}
