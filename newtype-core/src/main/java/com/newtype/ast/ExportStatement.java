package com.newtype.ast;

/**
 * The {@code export} marker. It carries no payload and renders to nothing.
 */
public record ExportStatement() implements Statement {
}
