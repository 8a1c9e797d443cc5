package org.pragmatica.toml.tree;

/**
 * Floating point value. Equality follows {@link Double#compare}, so {@code nan} equals {@code nan}.
 */
public record TomlFloat(double value) implements TomlValue {

    public static TomlFloat of(double value) {
        return new TomlFloat(value);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.FLOAT;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
