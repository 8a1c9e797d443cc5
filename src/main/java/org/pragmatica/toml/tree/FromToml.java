package org.pragmatica.toml.tree;

import org.pragmatica.toml.error.AccessorError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Conversion from a possibly absent TOML value into a Java type.
 *
 * <p>Conversions compose: element and entry conversions lift into lists, maps and optional values,
 * and {@link #table(Function)} reads a table into a record or any other type.
 * <pre>{@code
 * record Dependency(String name, Optional<String> version, List<String> features) {}
 *
 * FromToml<Dependency> dependency = FromToml.table(table ->
 *     table.get("name", FromToml.string()).flatMap(name ->
 *     table.get("version", FromToml.optional(FromToml.string())).flatMap(version ->
 *     table.get("features", FromToml.list(FromToml.string()))
 *          .map(features -> new Dependency(name, version, features)))));
 *
 * var deps = toml.get("dependencies", FromToml.list(dependency));
 * }</pre>
 *
 * <p>A conversion given no value fails with {@link AccessorError.Missing};
 * {@link TomlTable#get(String, FromToml)} turns that into {@link AccessorError.InvalidKey}.
 *
 * @param <T> converted type
 */
@FunctionalInterface
public interface FromToml<T> {

    AccessResult<T> convert(Optional<TomlValue> value);

    /**
     * Convert a value known to be present.
     */
    default AccessResult<T> convert(TomlValue value) {
        return convert(Optional.of(value));
    }

    /**
     * Transform the converted value.
     */
    default <R> FromToml<R> andThen(Function<? super T, ? extends R> mapper) {
        return value -> convert(value).map(mapper);
    }

    /**
     * Conversion through one of the {@link TomlValue} views. A value of another kind is a
     * {@link AccessorError.TypeMismatch} carrying the value.
     */
    static <T> FromToml<T> of(ValueKind expected, Function<TomlValue, Optional<T>> view) {
        return value -> value.map(present -> view.apply(present)
                                                 .map(AccessResult::<T>found)
                                                 .orElseGet(() -> AccessResult.failed(AccessorError.TypeMismatch.of(present, expected))))
                             .orElseGet(FromToml::missing);
    }

    static FromToml<TomlValue> value() {
        return value -> value.map(AccessResult::<TomlValue>found)
                             .orElseGet(FromToml::missing);
    }

    static FromToml<String> string() {
        return of(ValueKind.STRING, TomlValue::asString);
    }

    static FromToml<TomlText> text() {
        return of(ValueKind.STRING, TomlValue::asText);
    }

    static FromToml<Long> integer() {
        return of(ValueKind.INTEGER, TomlValue::asInteger);
    }

    static FromToml<Double> floating() {
        return of(ValueKind.FLOAT, TomlValue::asFloat);
    }

    static FromToml<Boolean> bool() {
        return of(ValueKind.BOOLEAN, TomlValue::asBoolean);
    }

    static FromToml<TomlArray> array() {
        return of(ValueKind.ARRAY, TomlValue::asArray);
    }

    static FromToml<TomlTable> table() {
        return of(ValueKind.TABLE, TomlValue::asTable);
    }

    /**
     * Any of the four date/time kinds. A mismatch reports {@link ValueKind#OFFSET_DATE_TIME} as expected.
     */
    static FromToml<TomlDateTime> dateTime() {
        return of(ValueKind.OFFSET_DATE_TIME, TomlValue::asDateTime);
    }

    /**
     * Read a table with the given reader. The reader usually chains {@link TomlTable#get(String, FromToml)} calls.
     */
    static <T> FromToml<T> table(Function<TomlTable, AccessResult<T>> reader) {
        var table = table();
        return value -> table.convert(value)
                             .flatMap(reader);
    }

    /**
     * Array whose elements all convert with {@code element}. Stops at the first failing element.
     */
    static <T> FromToml<List<T>> list(FromToml<T> element) {
        var array = array();
        return value -> array.convert(value)
                             .flatMap(found -> {
                                 var converted = new ArrayList<T>(found.size());
                                 for (var item : found) {
                                     var result = element.convert(item);
                                     if (result.isFailure()) {
                                         return AccessResult.failed(result.error()
                                                                          .orElseThrow());
                                     }
                                     converted.add(result.unwrap());
                                 }
                                 return AccessResult.found(Collections.unmodifiableList(converted));
                             });
    }

    /**
     * Absent values convert to {@link Optional#empty()}; present ones must convert with {@code inner}.
     */
    static <T> FromToml<Optional<T>> optional(FromToml<T> inner) {
        return value -> value.isEmpty()
                        ? AccessResult.found(Optional.empty())
                        : inner.convert(value)
                               .map(Optional::of);
    }

    /**
     * Table whose values all convert with {@code entry}, in declaration order. A failing entry reports its key.
     */
    static <T> FromToml<Map<String, T>> map(FromToml<T> entry) {
        var table = table();
        return value -> table.convert(value)
                             .flatMap(found -> {
                                 var converted = new LinkedHashMap<String, T>();
                                 for (var key : found.keys()) {
                                     var result = found.get(key, entry);
                                     if (result.isFailure()) {
                                         return AccessResult.failed(result.error()
                                                                          .orElseThrow());
                                     }
                                     converted.put(key, result.unwrap());
                                 }
                                 return AccessResult.found(Collections.unmodifiableMap(converted));
                             });
    }

    private static <T> AccessResult<T> missing() {
        return AccessResult.failed(new AccessorError.Missing());
    }
}
