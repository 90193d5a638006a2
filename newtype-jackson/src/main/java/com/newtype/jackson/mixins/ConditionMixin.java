package com.newtype.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.newtype.ast.Condition;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Condition.Comparison.class, name = "Comparison"),
    @JsonSubTypes.Type(value = Condition.Not.class, name = "Not"),
    @JsonSubTypes.Type(value = Condition.And.class, name = "And"),
    @JsonSubTypes.Type(value = Condition.Or.class, name = "Or")
})
public interface ConditionMixin {
}
