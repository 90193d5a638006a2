package com.newtype.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.newtype.ast.*;

/**
 * Expressions carry their variant in a {@code "type"} property, named after the record.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = StringLiteral.class, name = "StringLiteral"),
    @JsonSubTypes.Type(value = IntegerLiteral.class, name = "IntegerLiteral"),
    @JsonSubTypes.Type(value = DoubleLiteral.class, name = "DoubleLiteral"),
    @JsonSubTypes.Type(value = BooleanLiteral.class, name = "BooleanLiteral"),
    @JsonSubTypes.Type(value = ObjectLiteral.class, name = "ObjectLiteral"),
    @JsonSubTypes.Type(value = TypeApplication.class, name = "TypeApplication"),
    @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
    @JsonSubTypes.Type(value = InferIdentifier.class, name = "InferIdentifier"),
    @JsonSubTypes.Type(value = Tuple.class, name = "Tuple"),
    @JsonSubTypes.Type(value = ExtendsExpression.class, name = "ExtendsExpression"),
    @JsonSubTypes.Type(value = Union.class, name = "Union"),
    @JsonSubTypes.Type(value = Intersection.class, name = "Intersection"),
    @JsonSubTypes.Type(value = CaseStatement.class, name = "CaseStatement"),
    @JsonSubTypes.Type(value = CompoundConditional.class, name = "CompoundConditional"),
    @JsonSubTypes.Type(value = LetExpression.class, name = "LetExpression")
})
public interface ExpressionMixin {
}
