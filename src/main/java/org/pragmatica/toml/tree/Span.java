package org.pragmatica.toml.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive), as offsets into the source string.
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span: " + start + ".." + end);
        }
    }

    public static Span of(int start, int end) {
        return new Span(start, end);
    }

    public static Span at(int offset) {
        return new Span(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public String extract(String source) {
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
