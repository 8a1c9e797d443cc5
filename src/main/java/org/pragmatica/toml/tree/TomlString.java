package org.pragmatica.toml.tree;

/**
 * String value. See {@link TomlText} for when the characters are shared with the source.
 */
public record TomlString(TomlText text) implements TomlValue {

    public static TomlString of(String value) {
        return new TomlString(TomlText.owned(value));
    }

    public String value() {
        return text.toString();
    }

    public boolean isBorrowed() {
        return text.isBorrowed();
    }

    @Override
    public ValueKind kind() {
        return ValueKind.STRING;
    }

    @Override
    public String toString() {
        return '"' + value() + '"';
    }
}
