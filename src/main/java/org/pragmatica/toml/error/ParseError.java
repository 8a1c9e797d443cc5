package org.pragmatica.toml.error;

import org.pragmatica.toml.tree.SourceLocation;
import org.pragmatica.toml.tree.Span;

/**
 * Structural parse error: what went wrong and where.
 *
 * <p>A parse stops at the first error, so a failed parse carries exactly one of these.
 */
public record ParseError(ParseErrorKind kind, Span span) {

    public static ParseError of(ParseErrorKind kind, Span span) {
        return new ParseError(kind, span);
    }

    public static ParseError of(ParseErrorKind kind, int start, int end) {
        return new ParseError(kind, Span.of(start, end));
    }

    public String message() {
        return kind.description() + " at " + span;
    }

    /**
     * Message with the position resolved to line and column.
     */
    public String message(String source) {
        return kind.description() + " at " + SourceLocation.of(source, span.start());
    }

    /**
     * Render a multi-line diagnostic pointing at the offending source.
     */
    public String format(String source, String filename) {
        return Diagnostic.error(kind.name(), kind.description(), span)
                         .withLabel(labelFor(source))
                         .format(source, filename);
    }

    private String labelFor(String source) {
        if (span.start() >= source.length()) {
            return "input ends here";
        }
        return kind == ParseErrorKind.DUPLICATE_KEY
               ? "redefined here"
               : "";
    }

    public TomlParseException toException() {
        return new TomlParseException(this);
    }

    @Override
    public String toString() {
        return kind + "@" + span;
    }
}
