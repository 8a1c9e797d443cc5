package org.pragmatica.toml.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered sequence of values. Element kinds may be mixed.
 *
 * <p>Arrays declared with {@code [[name]]} headers are arrays of tables; only those grow after creation,
 * and only while the document is being parsed.
 */
public final class TomlArray implements TomlValue, Iterable<TomlValue> {
    private final List<TomlValue> values;
    private final boolean arrayOfTables;

    private TomlArray(List<TomlValue> values, boolean arrayOfTables) {
        this.values = values;
        this.arrayOfTables = arrayOfTables;
    }

    public static TomlArray of(List<? extends TomlValue> values) {
        return new TomlArray(new ArrayList<>(values), false);
    }

    public static TomlArray of(TomlValue... values) {
        return of(List.of(values));
    }

    static TomlArray ofTables() {
        return new TomlArray(new ArrayList<>(), true);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.ARRAY;
    }

    public boolean isArrayOfTables() {
        return arrayOfTables;
    }

    public List<TomlValue> values() {
        return Collections.unmodifiableList(values);
    }

    public TomlValue get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public Iterator<TomlValue> iterator() {
        return values().iterator();
    }

    void append(TomlValue value) {
        values.add(value);
    }

    TomlValue last() {
        return values.get(values.size() - 1);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof TomlArray array && values.equals(array.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
