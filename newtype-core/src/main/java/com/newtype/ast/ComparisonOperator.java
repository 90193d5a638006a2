package com.newtype.ast;

public enum ComparisonOperator {
    EXTENDS_LEFT("<:"),
    EXTENDS_RIGHT(":>"),
    EQUALS("=="),
    NOT_EQUALS("!=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /** The operator as written in Newtype source. */
    public String symbol() {
        return symbol;
    }

    /** Returns the operator spelled {@code symbol}, or null if there is none. */
    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator op : values()) {
            if (op.symbol().equals(symbol)) {
                return op;
            }
        }
        return null;
    }
}
