package org.pragmatica.toml.tree;

import org.pragmatica.toml.error.AccessorError;

import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a typed lookup - either the value or the reason it is not available.
 */
public sealed interface AccessResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The value, or an {@link IllegalStateException} describing the accessor error.
     */
    T unwrap();

    Optional<AccessorError> error();

    <R> R fold(Function<AccessorError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    default <R> AccessResult<R> map(Function<? super T, ? extends R> mapper) {
        return fold(AccessResult::failed, value -> found(mapper.apply(value)));
    }

    default <R> AccessResult<R> flatMap(Function<? super T, AccessResult<R>> mapper) {
        return fold(AccessResult::failed, mapper);
    }

    default T or(T fallback) {
        return fold(error -> fallback, value -> value);
    }

    default Optional<T> toOptional() {
        return fold(error -> Optional.empty(), Optional::of);
    }

    static <T> AccessResult<T> found(T value) {
        return new Found<>(value);
    }

    static <T> AccessResult<T> failed(AccessorError error) {
        return new Failed<>(error);
    }

    record Found<T>(T value) implements AccessResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public Optional<AccessorError> error() {
            return Optional.empty();
        }

        @Override
        public <R> R fold(Function<AccessorError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failed<T>(AccessorError cause) implements AccessResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException(cause.message());
        }

        @Override
        public Optional<AccessorError> error() {
            return Optional.of(cause);
        }

        @Override
        public <R> R fold(Function<AccessorError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }
    }
}
