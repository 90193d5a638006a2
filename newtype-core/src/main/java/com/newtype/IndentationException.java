package com.newtype;

/**
 * A continuation token sits at or left of the column its construct is anchored on.
 */
public class IndentationException extends ParseException {
    private final int actualColumn;
    private final int requiredColumn;

    public IndentationException(Token token, int requiredColumn) {
        super(token, "incorrect indentation (got " + token.column() + ", should be greater than " + requiredColumn + ")");
        this.actualColumn = token.column();
        this.requiredColumn = requiredColumn;
    }

    public int actualColumn() {
        return actualColumn;
    }

    public int requiredColumn() {
        return requiredColumn;
    }
}
