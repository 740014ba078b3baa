package me.christianrobert.namereduce.syntax;

import java.util.Objects;

/**
 * Half-open character range {@code [start, end)} into the text of one syntax tree snapshot.
 */
public class TextSpan {

    private final int start;
    private final int length;

    public TextSpan(int start, int length) {
        if (start < 0) {
            throw new IllegalArgumentException("Span start cannot be negative: " + start);
        }
        if (length < 0) {
            throw new IllegalArgumentException("Span length cannot be negative: " + length);
        }
        this.start = start;
        this.length = length;
    }

    public static TextSpan fromBounds(int start, int end) {
        return new TextSpan(start, end - start);
    }

    public int getStart() {
        return start;
    }

    public int getLength() {
        return length;
    }

    public int getEnd() {
        return start + length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    /**
     * Checks whether the other span lies completely within this one.
     */
    public boolean contains(TextSpan other) {
        return other.start >= start && other.getEnd() <= getEnd();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TextSpan textSpan = (TextSpan) o;
        return start == textSpan.start && length == textSpan.length;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, length);
    }

    @Override
    public String toString() {
        return "[" + start + ".." + getEnd() + ")";
    }
}
