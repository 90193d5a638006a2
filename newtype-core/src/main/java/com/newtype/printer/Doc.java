package com.newtype.printer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A layout document: text plus the places where it may or must break.
 *
 * <p>Documents are built with the static combinators below and turned into text by
 * {@link Layout}, which is the only place that decides between flat and broken
 * renderings.</p>
 */
public sealed interface Doc permits
    Doc.Empty,
    Doc.Text,
    Doc.HardLine,
    Doc.FlatAlt,
    Doc.Cat,
    Doc.Nest,
    Doc.Align,
    Doc.Group {

    record Empty() implements Doc {}

    /** Text without newlines. */
    record Text(String text) implements Doc {
        public Text {
            Objects.requireNonNull(text, "text");
            if (text.indexOf('\n') >= 0) {
                throw new IllegalArgumentException("Text must not contain newlines, use a line document");
            }
        }
    }

    /** A newline that survives flattening, so a group containing it never lays out flat. */
    record HardLine() implements Doc {}

    /** Renders {@code broken} normally and {@code flat} when an enclosing group is flattened. */
    record FlatAlt(Doc broken, Doc flat) implements Doc {}

    record Cat(List<Doc> parts) implements Doc {
        public Cat {
            parts = List.copyOf(parts);
        }
    }

    /** Increases the indentation of the lines inside by {@code indent} columns. */
    record Nest(int indent, Doc doc) implements Doc {}

    /** Sets the indentation of the lines inside to the column where it starts. */
    record Align(Doc doc) implements Doc {}

    /** Lays {@code doc} out flat if it fits the remaining width, broken otherwise. */
    record Group(Doc doc) implements Doc {}

    Doc EMPTY = new Empty();
    Doc HARD_LINE = new HardLine();

    // ========================================================================
    // Combinators
    // ========================================================================

    static Doc empty() {
        return EMPTY;
    }

    static Doc text(String text) {
        return text.isEmpty() ? EMPTY : new Text(text);
    }

    /** A newline, or a single space when flattened. */
    static Doc line() {
        return new FlatAlt(HARD_LINE, new Text(" "));
    }

    /** A newline, or nothing when flattened. */
    static Doc lineBreak() {
        return new FlatAlt(HARD_LINE, EMPTY);
    }

    static Doc hardLine() {
        return HARD_LINE;
    }

    static Doc flatAlt(Doc broken, Doc flat) {
        return new FlatAlt(broken, flat);
    }

    static Doc concat(Doc... parts) {
        return concat(List.of(parts));
    }

    static Doc concat(List<Doc> parts) {
        List<Doc> kept = new ArrayList<>(parts.size());
        for (Doc part : parts) {
            if (!(part instanceof Empty)) {
                kept.add(part);
            }
        }
        if (kept.isEmpty()) {
            return EMPTY;
        }
        return kept.size() == 1 ? kept.get(0) : new Cat(kept);
    }

    static Doc nest(int indent, Doc doc) {
        return new Nest(indent, doc);
    }

    static Doc align(Doc doc) {
        return new Align(doc);
    }

    static Doc group(Doc doc) {
        return new Group(doc);
    }

    /** Joins the documents with {@code separator} between each pair. */
    static Doc join(Doc separator, List<Doc> docs) {
        List<Doc> parts = new ArrayList<>(docs.size() * 2);
        for (int i = 0; i < docs.size(); i++) {
            if (i > 0) {
                parts.add(separator);
            }
            parts.add(docs.get(i));
        }
        return concat(parts);
    }

    /** Joins with a space. */
    static Doc spaced(Doc... docs) {
        return join(text(" "), List.of(docs));
    }

    /** Joins non-empty documents with hard newlines. */
    static Doc vsep(List<Doc> docs) {
        List<Doc> kept = new ArrayList<>(docs.size());
        for (Doc doc : docs) {
            if (!(doc instanceof Empty)) {
                kept.add(doc);
            }
        }
        return join(HARD_LINE, kept);
    }
}
