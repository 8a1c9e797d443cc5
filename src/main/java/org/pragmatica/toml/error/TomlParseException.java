package org.pragmatica.toml.error;

/**
 * Unchecked carrier for a {@link ParseError}.
 *
 * <p>Thrown by the lexer, decoders and parser to abort on the first structural error and
 * converted back into a value by {@code TomlParser}. Stack traces are not captured.
 */
public final class TomlParseException extends RuntimeException {
    private final ParseError error;

    public TomlParseException(ParseError error) {
        super(error.message(), null, false, false);
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
