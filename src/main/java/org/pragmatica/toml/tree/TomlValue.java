package org.pragmatica.toml.tree;

import java.util.Optional;

/**
 * A parsed TOML value. The set of variants is closed; use {@link #kind()} to dispatch.
 */
public sealed interface TomlValue
    permits TomlString, TomlInteger, TomlFloat, TomlBoolean, TomlArray, TomlTable, TomlDateTime {

    ValueKind kind();

    default Optional<String> asString() {
        return this instanceof TomlString string
               ? Optional.of(string.value())
               : Optional.empty();
    }

    default Optional<TomlText> asText() {
        return this instanceof TomlString string
               ? Optional.of(string.text())
               : Optional.empty();
    }

    default Optional<Long> asInteger() {
        return this instanceof TomlInteger integer
               ? Optional.of(integer.value())
               : Optional.empty();
    }

    default Optional<Double> asFloat() {
        return this instanceof TomlFloat number
               ? Optional.of(number.value())
               : Optional.empty();
    }

    default Optional<Boolean> asBoolean() {
        return this instanceof TomlBoolean bool
               ? Optional.of(bool.value())
               : Optional.empty();
    }

    default Optional<TomlArray> asArray() {
        return this instanceof TomlArray array
               ? Optional.of(array)
               : Optional.empty();
    }

    default Optional<TomlTable> asTable() {
        return this instanceof TomlTable table
               ? Optional.of(table)
               : Optional.empty();
    }

    default Optional<TomlDateTime> asDateTime() {
        return this instanceof TomlDateTime dateTime
               ? Optional.of(dateTime)
               : Optional.empty();
    }
}
