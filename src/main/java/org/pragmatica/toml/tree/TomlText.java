package org.pragmatica.toml.tree;

/**
 * Text of a parsed string, either a view over the source or a decoded copy.
 *
 * <p>Only basic strings containing escape sequences are {@link Owned}; everything else is a
 * {@link Borrowed} view that keeps a reference to the source string. Equality is by content,
 * regardless of variant.
 */
public sealed interface TomlText extends CharSequence {

    static TomlText borrowed(String source, Span span) {
        return new Borrowed(source, span.start(), span.end());
    }

    static TomlText owned(String value) {
        return new Owned(value);
    }

    boolean isBorrowed();

    /**
     * View over {@code source[start, end)}. No characters are copied until {@link #toString()}.
     */
    record Borrowed(String source, int start, int end) implements TomlText {
        public Borrowed {
            if (start < 0 || end < start || end > source.length()) {
                throw new IndexOutOfBoundsException("Span " + start + ".." + end + " outside source of length "
                                                    + source.length());
            }
        }

        public Span span() {
            return Span.of(start, end);
        }

        @Override
        public boolean isBorrowed() {
            return true;
        }

        @Override
        public int length() {
            return end - start;
        }

        @Override
        public char charAt(int index) {
            if (index < 0 || index >= length()) {
                throw new IndexOutOfBoundsException(index);
            }
            return source.charAt(start + index);
        }

        @Override
        public CharSequence subSequence(int from, int to) {
            if (from < 0 || to < from || to > length()) {
                throw new IndexOutOfBoundsException("Range " + from + ".." + to);
            }
            return new Borrowed(source, start + from, start + to);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof TomlText text && sameContent(this, text);
        }

        @Override
        public int hashCode() {
            return contentHash(this);
        }

        @Override
        public String toString() {
            return source.substring(start, end);
        }
    }

    /**
     * Decoded text that no longer matches the source verbatim.
     */
    record Owned(String value) implements TomlText {
        @Override
        public boolean isBorrowed() {
            return false;
        }

        @Override
        public int length() {
            return value.length();
        }

        @Override
        public char charAt(int index) {
            return value.charAt(index);
        }

        @Override
        public CharSequence subSequence(int from, int to) {
            return value.subSequence(from, to);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof TomlText text && sameContent(this, text);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value;
        }
    }

    private static boolean sameContent(CharSequence left, CharSequence right) {
        if (left.length() != right.length()) {
            return false;
        }
        for (int i = 0; i < left.length(); i++) {
            if (left.charAt(i) != right.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    // Same algorithm as String.hashCode, so both variants hash alike
    private static int contentHash(CharSequence text) {
        int hash = 0;
        for (int i = 0; i < text.length(); i++) {
            hash = 31 * hash + text.charAt(i);
        }
        return hash;
    }
}
