package org.pragmatica.toml.tree;

import org.pragmatica.toml.error.ParseError;
import org.pragmatica.toml.error.ParseErrorKind;
import org.pragmatica.toml.error.TomlParseException;

import java.util.List;

/**
 * The table tree of one document while it is being parsed.
 *
 * <p>Dotted keys, {@code [table]} headers and {@code [[array]]} headers all walk the tree through
 * {@link #resolveOrCreate(TomlTable, List, Walk)}, so {@code a.b.c = 1} and {@code [a.b] c = 1}
 * produce the same structure. Every rule violation is reported as {@link ParseErrorKind#DUPLICATE_KEY}
 * at the span of the offending key segment.
 */
public final class TableTree {

    private enum Walk {
        HEADER,
        DOTTED
    }

    private final TomlTable root = new TomlTable(TomlTable.Definition.ROOT);

    public TomlTable root() {
        return root;
    }

    /**
     * Fresh table for an inline {@code { ... }} value. Closed for extension from outside once built.
     */
    public TomlTable inlineTable() {
        return new TomlTable(TomlTable.Definition.INLINE);
    }

    /**
     * Handle a {@code [path]} header and return the table that subsequent assignments go into.
     */
    public TomlTable openTable(List<Key> path) {
        var parent = resolveOrCreate(root, prefix(path), Walk.HEADER);
        var last = last(path);
        var existing = parent.lookup(last.name());

        if (existing == null) {
            var table = new TomlTable(TomlTable.Definition.HEADER);
            parent.put(last.name(), table);
            return table;
        }
        if (existing instanceof TomlTable table && table.definition() == TomlTable.Definition.IMPLICIT) {
            table.define(TomlTable.Definition.HEADER);
            return table;
        }
        throw duplicate(last);
    }

    /**
     * Handle a {@code [[path]]} header: append a new table to the array at the path and return it.
     */
    public TomlTable appendArrayTable(List<Key> path) {
        var parent = resolveOrCreate(root, prefix(path), Walk.HEADER);
        var last = last(path);
        var existing = parent.lookup(last.name());
        var table = new TomlTable(TomlTable.Definition.HEADER);

        if (existing == null) {
            var array = TomlArray.ofTables();
            array.append(table);
            parent.put(last.name(), array);
            return table;
        }
        if (existing instanceof TomlArray array && array.isArrayOfTables()) {
            array.append(table);
            return table;
        }
        throw duplicate(last);
    }

    /**
     * Store {@code value} under a possibly dotted key, relative to {@code current}.
     */
    public void assign(TomlTable current, List<Key> path, TomlValue value) {
        var parent = resolveOrCreate(current, prefix(path), Walk.DOTTED);
        var last = last(path);

        if (parent.lookup(last.name()) != null) {
            throw duplicate(last);
        }
        parent.put(last.name(), value);
    }

    private static TomlTable resolveOrCreate(TomlTable start, List<Key> segments, Walk walk) {
        var table = start;

        for (var segment : segments) {
            var existing = table.lookup(segment.name());

            if (existing == null) {
                var created = new TomlTable(walk == Walk.HEADER
                                            ? TomlTable.Definition.IMPLICIT
                                            : TomlTable.Definition.DOTTED);
                table.put(segment.name(), created);
                table = created;
            } else if (existing instanceof TomlTable child && canEnter(child, walk)) {
                table = child;
            } else if (existing instanceof TomlArray array && array.isArrayOfTables() && walk == Walk.HEADER) {
                table = (TomlTable) array.last();
            } else {
                throw duplicate(segment);
            }
        }
        return table;
    }

    private static boolean canEnter(TomlTable table, Walk walk) {
        return switch (table.definition()) {
            case INLINE, ROOT -> false;
            case DOTTED -> true;
            case HEADER, IMPLICIT -> walk == Walk.HEADER;
        };
    }

    private static List<Key> prefix(List<Key> path) {
        return path.subList(0, path.size() - 1);
    }

    private static Key last(List<Key> path) {
        return path.get(path.size() - 1);
    }

    private static TomlParseException duplicate(Key key) {
        return ParseError.of(ParseErrorKind.DUPLICATE_KEY, key.span())
                         .toException();
    }
}
