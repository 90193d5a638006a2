package com.newtype;

/**
 * A lexeme together with where it sits in the source. Lines and columns are 1-based.
 *
 * @param literal the decoded value for literal tokens (BigInteger, Double, String), otherwise null
 */
public record Token(
    TokenType type,
    String lexeme,
    Object literal,
    int line,
    int column
) {
    /** What the token looks like in an error message. */
    public String describe() {
        return switch (type) {
            case EOF -> "end of input";
            case STRING -> "string " + lexeme;
            case INTEGER, DOUBLE -> "number " + lexeme;
            default -> "'" + lexeme + "'";
        };
    }
}
