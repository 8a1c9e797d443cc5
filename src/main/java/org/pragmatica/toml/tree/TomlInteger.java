package org.pragmatica.toml.tree;

public record TomlInteger(long value) implements TomlValue {

    public static TomlInteger of(long value) {
        return new TomlInteger(value);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.INTEGER;
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
