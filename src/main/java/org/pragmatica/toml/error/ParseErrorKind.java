package org.pragmatica.toml.error;

/**
 * Kinds of structural errors a parse can fail with.
 */
public enum ParseErrorKind {
    UNEXPECTED_CHARACTER("unexpected character"),
    INVALID_BARE_KEY("invalid character in bare key"),
    EXPECTED_KEY("expected a key"),
    EXPECTED_EQUALS("expected '=' after key"),
    EXPECTED_VALUE("expected a value"),
    EXPECTED_NEWLINE("expected a newline after the key/value pair or table header"),
    MISSING_COMMA("expected ',' between values"),
    UNTERMINATED_STRING("unterminated string"),
    INVALID_ESCAPE("unknown escape sequence"),
    INVALID_UNICODE_SCALAR("escape does not name a unicode scalar value"),
    INVALID_NUMBER("malformed number"),
    LEADING_ZERO("decimal number has a leading zero"),
    NUMBER_TOO_LARGE("number does not fit in 64 bits"),
    UNCLOSED_BRACKET("unclosed bracket"),
    DUPLICATE_KEY("key is already defined"),
    UNEXPECTED_END_OF_INPUT("unexpected end of input"),
    INVALID_ENCODING("input is not valid UTF-8"),
    INPUT_TOO_LARGE("input exceeds the configured maximum length"),
    NESTING_TOO_DEEP("arrays and inline tables are nested too deeply");

    private final String description;

    ParseErrorKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
