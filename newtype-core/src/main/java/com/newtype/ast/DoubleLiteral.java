package com.newtype.ast;

public record DoubleLiteral(double value) implements Expression {
}
