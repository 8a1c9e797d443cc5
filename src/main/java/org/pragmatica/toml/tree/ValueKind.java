package org.pragmatica.toml.tree;

/**
 * The variant of a {@link TomlValue}.
 */
public enum ValueKind {
    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    TABLE("table"),
    LOCAL_DATE("local date"),
    LOCAL_TIME("local time"),
    LOCAL_DATE_TIME("local date-time"),
    OFFSET_DATE_TIME("offset date-time");

    private final String displayName;

    ValueKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isDateTime() {
        return this == LOCAL_DATE || this == LOCAL_TIME || this == LOCAL_DATE_TIME || this == OFFSET_DATE_TIME;
    }
}
