package org.pragmatica.toml.parser;

import org.pragmatica.toml.Toml;
import org.pragmatica.toml.error.ParseError;

import java.util.Optional;
import java.util.function.Function;

/**
 * Result of parsing a document - either the parsed document or the first error.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The document, or the error rethrown as {@link org.pragmatica.toml.error.TomlParseException}.
     */
    Toml unwrap();

    Optional<ParseError> error();

    <R> R fold(Function<ParseError, ? extends R> onFailure, Function<Toml, ? extends R> onSuccess);

    default Optional<Toml> toOptional() {
        return fold(error -> Optional.empty(), Optional::of);
    }

    static ParseResult success(Toml document) {
        return new Success(document);
    }

    static ParseResult failure(ParseError error) {
        return new Failure(error);
    }

    /**
     * Successful parse.
     */
    record Success(Toml document) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Toml unwrap() {
            return document;
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.empty();
        }

        @Override
        public <R> R fold(Function<ParseError, ? extends R> onFailure, Function<Toml, ? extends R> onSuccess) {
            return onSuccess.apply(document);
        }
    }

    /**
     * Failed parse, stopped at the first error.
     */
    record Failure(ParseError cause) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Toml unwrap() {
            throw cause.toException();
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.of(cause);
        }

        @Override
        public <R> R fold(Function<ParseError, ? extends R> onFailure, Function<Toml, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }
    }
}
