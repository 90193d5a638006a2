package com.newtype.ast;

public record BooleanLiteral(boolean value) implements Expression {
}
