package com.newtype;

/**
 * A single diagnostic produced while parsing. Lines and columns are 1-based.
 */
public record ParseError(int line, int column, String message) {
    @Override
    public String toString() {
        return line + ":" + column + ": " + message;
    }
}
