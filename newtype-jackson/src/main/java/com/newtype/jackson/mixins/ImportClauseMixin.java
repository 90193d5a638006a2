package com.newtype.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.newtype.ast.ImportClause;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ImportClause.Default.class, name = "ImportDefault"),
    @JsonSubTypes.Type(value = ImportClause.Namespace.class, name = "ImportNamespace"),
    @JsonSubTypes.Type(value = ImportClause.Named.class, name = "ImportNamed"),
    @JsonSubTypes.Type(value = ImportClause.DefaultAndNamespace.class, name = "ImportDefaultAndNamespace"),
    @JsonSubTypes.Type(value = ImportClause.DefaultAndNamed.class, name = "ImportDefaultAndNamed")
})
public interface ImportClauseMixin {
}
