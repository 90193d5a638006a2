package com.newtype.printer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Turns a {@link Doc} into text.
 *
 * <p>Each group is laid out flat when its flat rendering, plus whatever follows it up
 * to the next line break, fits in the rest of the line; otherwise every line inside
 * the group breaks. A group that contains a hard line always breaks. With an
 * unbounded page width that is the only reason a group breaks.</p>
 *
 * <p>Indentation is written lazily, so lines never end in whitespace.</p>
 */
public final class Layout {

    private enum Mode { FLAT, BREAK }

    private record Item(int indent, Mode mode, Doc doc) {}

    private final long pageWidth;

    private Layout(LayoutOptions options) {
        this.pageWidth = options.isUnbounded() ? Long.MAX_VALUE : options.pageWidth();
    }

    public static String render(Doc doc) {
        return render(doc, LayoutOptions.unbounded());
    }

    public static String render(Doc doc, LayoutOptions options) {
        return new Layout(options).run(doc);
    }

    private String run(Doc root) {
        StringBuilder out = new StringBuilder();
        Deque<Item> stack = new ArrayDeque<>();
        stack.push(new Item(0, Mode.BREAK, root));
        int column = 0;
        int pendingIndent = 0;

        while (!stack.isEmpty()) {
            Item item = stack.pop();
            Doc doc = item.doc();

            if (doc instanceof Doc.Text text) {
                if (pendingIndent > 0) {
                    out.append(" ".repeat(pendingIndent));
                    pendingIndent = 0;
                }
                out.append(text.text());
                column += text.text().length();
            } else if (doc instanceof Doc.HardLine) {
                out.append('\n');
                column = item.indent();
                pendingIndent = item.indent();
            } else if (doc instanceof Doc.FlatAlt alt) {
                stack.push(new Item(item.indent(), item.mode(), item.mode() == Mode.FLAT ? alt.flat() : alt.broken()));
            } else if (doc instanceof Doc.Cat cat) {
                pushAll(stack, item, cat.parts());
            } else if (doc instanceof Doc.Nest nest) {
                stack.push(new Item(item.indent() + nest.indent(), item.mode(), nest.doc()));
            } else if (doc instanceof Doc.Align align) {
                stack.push(new Item(column, item.mode(), align.doc()));
            } else if (doc instanceof Doc.Group group) {
                if (item.mode() == Mode.FLAT) {
                    stack.push(new Item(item.indent(), Mode.FLAT, group.doc()));
                } else {
                    Item flat = new Item(item.indent(), Mode.FLAT, group.doc());
                    boolean fits = fits(pageWidth - column, flat, stack);
                    stack.push(fits ? flat : new Item(item.indent(), Mode.BREAK, group.doc()));
                }
            }
            // Doc.Empty renders nothing
        }
        return out.toString();
    }

    /**
     * Checks whether {@code first}, followed by the pending items up to the next
     * line break, fits in {@code width} columns.
     */
    private static boolean fits(long width, Item first, Deque<Item> rest) {
        Deque<Item> work = new ArrayDeque<>();
        work.push(first);
        Iterator<Item> pending = rest.iterator();

        while (width >= 0) {
            if (work.isEmpty()) {
                if (!pending.hasNext()) {
                    return true;
                }
                work.push(pending.next());
            }
            Item item = work.pop();
            Doc doc = item.doc();

            if (doc instanceof Doc.Text text) {
                width -= text.text().length();
            } else if (doc instanceof Doc.HardLine) {
                // A hard line cannot be flattened; in broken mode the line ends here and fits
                return item.mode() == Mode.BREAK;
            } else if (doc instanceof Doc.FlatAlt alt) {
                work.push(new Item(item.indent(), item.mode(), item.mode() == Mode.FLAT ? alt.flat() : alt.broken()));
            } else if (doc instanceof Doc.Cat cat) {
                pushAll(work, item, cat.parts());
            } else if (doc instanceof Doc.Nest nest) {
                work.push(new Item(item.indent() + nest.indent(), item.mode(), nest.doc()));
            } else if (doc instanceof Doc.Align align) {
                work.push(new Item(item.indent(), item.mode(), align.doc()));
            } else if (doc instanceof Doc.Group group) {
                work.push(new Item(item.indent(), item.mode(), group.doc()));
            }
        }
        return false;
    }

    private static void pushAll(Deque<Item> stack, Item parent, List<Doc> parts) {
        for (int i = parts.size() - 1; i >= 0; i--) {
            stack.push(new Item(parent.indent(), parent.mode(), parts.get(i)));
        }
    }
}
