package org.pragmatica.toml.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.toml.TomlParser;
import org.pragmatica.toml.tree.Span;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ParseErrorTest {

    @Test
    void message_combinesDescriptionAndSpan() {
        var error = ParseError.of(ParseErrorKind.MISSING_COMMA, 7, 8);

        assertEquals("expected ',' between values at 7..8", error.message());
    }

    @Test
    void message_withSource_resolvesLineAndColumn() {
        var error = ParseError.of(ParseErrorKind.EXPECTED_VALUE, 12, 13);

        assertEquals("expected a value at 2:7", error.message("a = 1\nkey = \n"));
    }

    @Test
    void format_duplicateKey_labelsRedefinition() {
        var source = "[package]\nname = \"x\"\nname = \"y\"";
        var error = TomlParser.parse(source).error().orElseThrow();

        var output = error.format(source, "Cargo.toml");

        assertThat(output).startsWith("error[DUPLICATE_KEY]: key is already defined\n  --> Cargo.toml:3:1\n");
        assertThat(output).contains("^^^^ redefined here");
    }

    @Test
    void format_errorAtEndOfInput_saysSo() {
        var source = "key =";
        var error = TomlParser.parse(source).error().orElseThrow();

        assertEquals(Span.at(5), error.span());
        assertThat(error.format(source, null)).contains("^ input ends here");
    }

    @Test
    void toException_carriesErrorAndMessage() {
        var error = ParseError.of(ParseErrorKind.LEADING_ZERO, Span.of(4, 6));

        var exception = error.toException();

        assertSame(error, exception.error());
        assertEquals(error.message(), exception.getMessage());
        assertEquals(0, exception.getStackTrace().length);
    }

    @Test
    void equalErrors_areEqual() {
        assertEquals(ParseError.of(ParseErrorKind.INVALID_NUMBER, 1, 2), ParseError.of(ParseErrorKind.INVALID_NUMBER, Span.of(1, 2)));
        assertEquals("INVALID_NUMBER@1..2", ParseError.of(ParseErrorKind.INVALID_NUMBER, 1, 2).toString());
    }
}
