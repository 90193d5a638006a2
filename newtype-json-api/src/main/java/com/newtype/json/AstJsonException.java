package com.newtype.json;

/**
 * Thrown when an AST cannot be written as JSON or rebuilt from it.
 */
public class AstJsonException extends RuntimeException {
    private final Class<?> nodeType;

    public AstJsonException(String message) {
        this(message, null, null);
    }

    /**
     * @param nodeType the node family being written or read ({@code Program},
     *                 {@code Statement} or {@code Expression}), or null
     */
    public AstJsonException(String message, Class<?> nodeType, Throwable cause) {
        super(nodeType == null ? message : message + " (" + nodeType.getSimpleName() + ")", cause);
        this.nodeType = nodeType;
    }

    /** The node family involved, or null when the failure is not tied to one. */
    public Class<?> nodeType() {
        return nodeType;
    }
}
