package com.newtype;

public class UnexpectedTokenException extends ParseException {
    private final Token token;

    public UnexpectedTokenException(Token token, String expected) {
        super(token, "unexpected " + token.describe() + ", expecting " + expected);
        this.token = token;
    }

    public Token token() {
        return token;
    }
}
