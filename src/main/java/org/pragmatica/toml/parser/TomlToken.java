package org.pragmatica.toml.parser;

import org.pragmatica.toml.tree.Span;
import org.pragmatica.toml.tree.ValueKind;

/**
 * Token types for the TOML lexer.
 */
public sealed interface TomlToken {
    Span span();

    // Keys and literals
    record BareKey(Span span) implements TomlToken {}

    /**
     * {@code "..."} or {@code """..."""}. {@code content} excludes the delimiters and the trimmed
     * leading newline; {@code hasEscapes} is set when any backslash occurs inside.
     */
    record BasicString(Span span, Span content, boolean multiline, boolean hasEscapes) implements TomlToken {}

    record LiteralString(Span span, Span content, boolean multiline) implements TomlToken {}

    /**
     * Integer or float literal, including sign, base prefix, {@code inf} and {@code nan}. Not yet validated.
     */
    record Number(Span span, boolean hasUnderscores) implements TomlToken {}

    record Bool(Span span, boolean value) implements TomlToken {}

    record DateTime(Span span, ValueKind kind) implements TomlToken {}

    // Punctuation
    record Equals(Span span) implements TomlToken {}

    // =
    record Dot(Span span) implements TomlToken {}

    // .
    record Comma(Span span) implements TomlToken {}

    // ,
    record LBracket(Span span) implements TomlToken {}

    // [
    record RBracket(Span span) implements TomlToken {}

    // ]
    record LBrace(Span span) implements TomlToken {}

    // {
    record RBrace(Span span) implements TomlToken {}

    // }
    // Special
    record Newline(Span span) implements TomlToken {}

    record Eof(Span span) implements TomlToken {}
}
