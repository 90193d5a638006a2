package com.newtype;

import java.util.List;

/**
 * Raised by the lexer and parser on the first grammar violation. Parsing does not
 * recover, so the exception always describes exactly one error.
 */
public class ParseException extends RuntimeException {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.toString());
        this.error = error;
    }

    public ParseException(int line, int column, String message) {
        this(new ParseError(line, column, message));
    }

    public ParseException(Token token, String message) {
        this(token.line(), token.column(), message);
    }

    public ParseError error() {
        return error;
    }

    /** The errors in source order, as exposed to callers. */
    public List<ParseError> errors() {
        return List.of(error);
    }
}
