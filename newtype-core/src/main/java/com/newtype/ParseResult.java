package com.newtype;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Outcome of a parse: either a value or the errors that stopped it. Never both.
 */
public record ParseResult<T>(T value, List<ParseError> errors) {
    public ParseResult {
        errors = List.copyOf(errors);
        if ((value == null) == errors.isEmpty()) {
            throw new IllegalArgumentException("ParseResult needs either a value or errors");
        }
    }

    public static <T> ParseResult<T> success(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), List.of());
    }

    public static <T> ParseResult<T> failure(List<ParseError> errors) {
        return new ParseResult<>(null, errors);
    }

    public boolean isSuccess() {
        return value != null;
    }

    /**
     * Returns the parsed value.
     *
     * @throws NoSuchElementException if parsing failed
     */
    public T get() {
        if (value == null) {
            throw new NoSuchElementException("parse failed: " + errors);
        }
        return value;
    }
}
