package com.newtype.printer;

/**
 * Page settings for {@link Layout}.
 *
 * @param pageWidth the column budget a group must fit into to stay flat, or
 *                  {@link #UNBOUNDED} for no limit
 */
public record LayoutOptions(int pageWidth) {
    public static final int UNBOUNDED = -1;

    private static final LayoutOptions UNBOUNDED_OPTIONS = new LayoutOptions(UNBOUNDED);

    public LayoutOptions {
        if (pageWidth != UNBOUNDED && pageWidth <= 0) {
            throw new IllegalArgumentException("page width must be positive, got " + pageWidth);
        }
    }

    /** No width limit: groups break only when they contain a hard line. */
    public static LayoutOptions unbounded() {
        return UNBOUNDED_OPTIONS;
    }

    public static LayoutOptions width(int pageWidth) {
        return new LayoutOptions(pageWidth);
    }

    public boolean isUnbounded() {
        return pageWidth == UNBOUNDED;
    }
}
