package org.pragmatica.toml.tree;

public record TomlBoolean(boolean value) implements TomlValue {
    public static final TomlBoolean TRUE = new TomlBoolean(true);
    public static final TomlBoolean FALSE = new TomlBoolean(false);

    public static TomlBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.BOOLEAN;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
