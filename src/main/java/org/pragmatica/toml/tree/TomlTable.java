package org.pragmatica.toml.tree;

import org.pragmatica.toml.error.AccessorError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered mapping from key to value. Keys are unique; iteration follows declaration order.
 *
 * <p>Tables are built during a single parse and are read-only afterwards. All lookups are
 * single-level; dotted paths are navigated by chaining {@link #getTable(String)}.
 */
public final class TomlTable implements TomlValue {

    /**
     * How the table came into existence. Decides whether a later header or dotted key may reopen it.
     */
    enum Definition {
        ROOT,
        // intermediate segment of a [header], may still be defined once by its own header
        IMPLICIT,
        HEADER,
        DOTTED,
        INLINE
    }

    private final Map<String, TomlValue> entries = new LinkedHashMap<>();
    private Definition definition;

    TomlTable(Definition definition) {
        this.definition = definition;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.TABLE;
    }

    public Optional<TomlValue> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Convert the value under {@code key}. A missing value fails with {@link AccessorError.InvalidKey},
     * and conversion errors are reported against {@code key}.
     */
    public <T> AccessResult<T> get(String key, FromToml<T> conversion) {
        var result = conversion.convert(get(key));
        return result.error()
                     .<AccessResult<T>>map(error -> AccessResult.failed(error.withKey(key)))
                     .orElse(result);
    }

    public AccessResult<String> getString(String key) {
        return get(key, FromToml.string());
    }

    /**
     * Like {@link #getString(String)}, without materializing borrowed text.
     */
    public AccessResult<TomlText> getText(String key) {
        return get(key, FromToml.text());
    }

    public AccessResult<Long> getInteger(String key) {
        return get(key, FromToml.integer());
    }

    public AccessResult<Double> getFloat(String key) {
        return get(key, FromToml.floating());
    }

    public AccessResult<Boolean> getBoolean(String key) {
        return get(key, FromToml.bool());
    }

    public AccessResult<TomlArray> getArray(String key) {
        return get(key, FromToml.array());
    }

    public AccessResult<TomlTable> getTable(String key) {
        return get(key, FromToml.table());
    }

    /**
     * Any of the four date/time kinds. A mismatch reports {@link ValueKind#OFFSET_DATE_TIME} as expected.
     */
    public AccessResult<TomlDateTime> getDateTime(String key) {
        return get(key, FromToml.dateTime());
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Map<String, TomlValue> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    // Build-time operations, used by TableTree only

    TomlValue lookup(String key) {
        return entries.get(key);
    }

    void put(String key, TomlValue value) {
        entries.put(key, value);
    }

    Definition definition() {
        return definition;
    }

    void define(Definition newDefinition) {
        this.definition = newDefinition;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof TomlTable table && entries.equals(table.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
