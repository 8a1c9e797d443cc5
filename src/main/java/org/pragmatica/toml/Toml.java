package org.pragmatica.toml;

import org.pragmatica.toml.tree.AccessResult;
import org.pragmatica.toml.tree.FromToml;
import org.pragmatica.toml.tree.TomlArray;
import org.pragmatica.toml.tree.TomlDateTime;
import org.pragmatica.toml.tree.TomlTable;
import org.pragmatica.toml.tree.TomlText;
import org.pragmatica.toml.tree.TomlValue;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A parsed document: the root table together with the source text its strings may borrow from.
 *
 * <p>All accessors delegate to {@link #table()}.
 */
public record Toml(String source, TomlTable table) {

    public Optional<TomlValue> get(String key) {
        return table.get(key);
    }

    public <T> AccessResult<T> get(String key, FromToml<T> conversion) {
        return table.get(key, conversion);
    }

    public AccessResult<String> getString(String key) {
        return table.getString(key);
    }

    public AccessResult<TomlText> getText(String key) {
        return table.getText(key);
    }

    public AccessResult<Long> getInteger(String key) {
        return table.getInteger(key);
    }

    public AccessResult<Double> getFloat(String key) {
        return table.getFloat(key);
    }

    public AccessResult<Boolean> getBoolean(String key) {
        return table.getBoolean(key);
    }

    public AccessResult<TomlArray> getArray(String key) {
        return table.getArray(key);
    }

    public AccessResult<TomlTable> getTable(String key) {
        return table.getTable(key);
    }

    public AccessResult<TomlDateTime> getDateTime(String key) {
        return table.getDateTime(key);
    }

    public boolean containsKey(String key) {
        return table.containsKey(key);
    }

    public Set<String> keys() {
        return table.keys();
    }

    public Map<String, TomlValue> asMap() {
        return table.asMap();
    }

    public int size() {
        return table.size();
    }

    public boolean isEmpty() {
        return table.isEmpty();
    }

    @Override
    public String toString() {
        return table.toString();
    }
}
