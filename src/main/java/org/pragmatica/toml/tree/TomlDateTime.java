package org.pragmatica.toml.tree;

/**
 * Date and/or time value, kept as the raw text that matched the RFC 3339 shape.
 *
 * <p>Field ranges are not checked: {@code 2024-13-45} is accepted as a {@link ValueKind#LOCAL_DATE}.
 * Converting to a calendar type is left to the caller.
 */
public record TomlDateTime(ValueKind kind, TomlText text) implements TomlValue {

    public TomlDateTime {
        if (!kind.isDateTime()) {
            throw new IllegalArgumentException("Not a date/time kind: " + kind);
        }
    }

    public String raw() {
        return text.toString();
    }

    @Override
    public String toString() {
        return raw();
    }
}
