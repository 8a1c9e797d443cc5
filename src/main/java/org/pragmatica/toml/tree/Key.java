package org.pragmatica.toml.tree;

/**
 * One segment of a (possibly dotted) key, with the span it was written at.
 */
public record Key(String name, Span span) {

    public static Key of(String name, Span span) {
        return new Key(name, span);
    }

    @Override
    public String toString() {
        return name;
    }
}
