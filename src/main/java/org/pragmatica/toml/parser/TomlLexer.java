package org.pragmatica.toml.parser;

import org.pragmatica.toml.error.ParseError;
import org.pragmatica.toml.error.ParseErrorKind;
import org.pragmatica.toml.error.TomlParseException;
import org.pragmatica.toml.tree.Span;
import org.pragmatica.toml.tree.ValueKind;

/**
 * Pull-based lexer for TOML documents.
 *
 * <p>TOML tokens depend on context ({@code 1234} is a key on the left of {@code =} and an integer on
 * the right), so the parser asks for each token in a {@link Mode}. Tokens are produced one at a time
 * in a single forward pass; the lexer cannot be rewound. Whitespace and comments are skipped, newlines
 * are returned as tokens.
 */
public final class TomlLexer {
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    public enum Mode {
        KEY,
        VALUE
    }

    private final String input;
    private int pos;

    public TomlLexer(String input) {
        this.input = input;
        this.pos = !input.isEmpty() && input.charAt(0) == BYTE_ORDER_MARK
                   ? 1
                   : 0;
    }

    public int position() {
        return pos;
    }

    /**
     * Next token. Returns {@link TomlToken.Eof} at, and after, the end of input.
     */
    public TomlToken next(Mode mode) {
        skipWhitespaceAndComments();
        if (isAtEnd()) {
            return new TomlToken.Eof(Span.at(input.length()));
        }
        int start = pos;
        char c = peek();
        switch (c) {
            case '\n':
                pos++ ;
                return new TomlToken.Newline(span(start));
            case '\r':
                return scanCarriageReturn(start);
            case '=':
                pos++ ;
                return new TomlToken.Equals(span(start));
            case '.':
                pos++ ;
                return new TomlToken.Dot(span(start));
            case ',':
                pos++ ;
                return new TomlToken.Comma(span(start));
            case '[':
                pos++ ;
                return new TomlToken.LBracket(span(start));
            case ']':
                pos++ ;
                return new TomlToken.RBracket(span(start));
            case '{':
                pos++ ;
                return new TomlToken.LBrace(span(start));
            case '}':
                pos++ ;
                return new TomlToken.RBrace(span(start));
            case '"':
                return scanBasicString(start);
            case '\'':
                return scanLiteralString(start);
            default:
                return mode == Mode.KEY
                       ? scanBareKey(start)
                       : scanValue(start);
        }
    }

    /**
     * Consume the end of a key/value line: a newline or end of input, possibly after a comment.
     */
    public TomlToken nextLineEnd() {
        skipWhitespaceAndComments();
        if (isAtEnd()) {
            return new TomlToken.Eof(Span.at(input.length()));
        }
        int start = pos;
        if (peek() == '\n') {
            pos++ ;
            return new TomlToken.Newline(span(start));
        }
        if (peek() == '\r') {
            return scanCarriageReturn(start);
        }
        int end = start;
        while (end < input.length() && !isWhitespaceOrNewline(input.charAt(end))) {
            end++ ;
        }
        throw error(ParseErrorKind.EXPECTED_NEWLINE, start, end);
    }

    private TomlToken scanCarriageReturn(int start) {
        if (pos + 1 < input.length() && input.charAt(pos + 1) == '\n') {
            pos += 2;
            return new TomlToken.Newline(span(start));
        }
        throw error(ParseErrorKind.UNEXPECTED_CHARACTER, start, start + 1);
    }

    private TomlToken scanBareKey(int start) {
        while (!isAtEnd() && isBareKeyChar(peek())) {
            pos++ ;
        }
        if (pos == start) {
            throw error(ParseErrorKind.INVALID_BARE_KEY, start, start + Character.charCount(input.codePointAt(start)));
        }
        return new TomlToken.BareKey(span(start));
    }

    private TomlToken scanValue(int start) {
        var dateTime = scanDateTime(start);
        if (dateTime != null) {
            return dateTime;
        }
        char c = peek();
        if (c == 't' || c == 'f') {
            return scanBoolean(start);
        }
        if (startsNumber(start)) {
            return scanNumber(start);
        }
        int end = c == '+' || c == '-' ? start + 1 : start;
        while (end < input.length() && isAsciiLetterOrDigit(input.charAt(end))) {
            end++ ;
        }
        throw error(ParseErrorKind.EXPECTED_VALUE, start, end == start ? wordEnd(start) : end);
    }

    // Digit, or exactly inf/nan, after an optional sign
    private boolean startsNumber(int start) {
        int at = start;
        if (charIs(at, '+') || charIs(at, '-')) {
            at++ ;
        }
        if (at < input.length() && isDigit(input.charAt(at))) {
            return true;
        }
        return (input.startsWith("inf", at) || input.startsWith("nan", at))
               && (at + 3 == input.length() || !isBareKeyChar(input.charAt(at + 3)));
    }

    private TomlToken scanBoolean(int start) {
        int end = wordEnd(start);
        var word = input.substring(start, end);
        if (word.equals("true") || word.equals("false")) {
            pos = end;
            return new TomlToken.Bool(span(start), word.equals("true"));
        }
        throw error(ParseErrorKind.EXPECTED_VALUE, start, end);
    }

    private TomlToken scanNumber(int start) {
        if (peek() == '+' || peek() == '-') {
            pos++ ;
        }
        int digitsStart = pos;
        if (input.startsWith("inf", pos) || input.startsWith("nan", pos)) {
            pos += 3;
            return new TomlToken.Number(span(start), false);
        }
        boolean prefixed = input.startsWith("0x", digitsStart);
        boolean underscores = false;
        while (!isAtEnd()) {
            char c = peek();
            if (isAsciiLetterOrDigit(c) || c == '.') {
                pos++ ;
            } else if (c == '_') {
                underscores = true;
                pos++ ;
            } else if ((c == '+' || c == '-') && !prefixed && pos > digitsStart && isExponentMarker(input.charAt(pos - 1))) {
                pos++ ;
            } else {
                break;
            }
        }
        return new TomlToken.Number(span(start), underscores);
    }

    // Date/time shapes only; field ranges are not checked
    private TomlToken scanDateTime(int start) {
        int dateEnd = matchDate(start);
        if (dateEnd > 0) {
            int timeEnd = -1;
            if (dateEnd < input.length()) {
                char separator = input.charAt(dateEnd);
                if (separator == 'T' || separator == 't' || separator == ' ') {
                    timeEnd = matchTime(dateEnd + 1);
                }
            }
            if (timeEnd < 0) {
                pos = dateEnd;
                return new TomlToken.DateTime(span(start), ValueKind.LOCAL_DATE);
            }
            int offsetEnd = matchOffset(timeEnd);
            if (offsetEnd < 0) {
                pos = timeEnd;
                return new TomlToken.DateTime(span(start), ValueKind.LOCAL_DATE_TIME);
            }
            pos = offsetEnd;
            return new TomlToken.DateTime(span(start), ValueKind.OFFSET_DATE_TIME);
        }
        int timeEnd = matchTime(start);
        if (timeEnd > 0) {
            pos = timeEnd;
            return new TomlToken.DateTime(span(start), ValueKind.LOCAL_TIME);
        }
        return null;
    }

    // YYYY-MM-DD
    private int matchDate(int at) {
        if (digits(at, 4) && charIs(at + 4, '-') && digits(at + 5, 2) && charIs(at + 7, '-') && digits(at + 8, 2)) {
            return at + 10;
        }
        return -1;
    }

    // HH:MM:SS[.fraction]
    private int matchTime(int at) {
        if (!(digits(at, 2) && charIs(at + 2, ':') && digits(at + 3, 2) && charIs(at + 5, ':') && digits(at + 6, 2))) {
            return -1;
        }
        int end = at + 8;
        if (charIs(end, '.') && digits(end + 1, 1)) {
            end++ ;
            while (end < input.length() && isDigit(input.charAt(end))) {
                end++ ;
            }
        }
        return end;
    }

    // Z or +HH:MM / -HH:MM
    private int matchOffset(int at) {
        if (charIs(at, 'Z') || charIs(at, 'z')) {
            return at + 1;
        }
        if ((charIs(at, '+') || charIs(at, '-')) && digits(at + 1, 2) && charIs(at + 3, ':') && digits(at + 4, 2)) {
            return at + 6;
        }
        return -1;
    }

    private TomlToken scanBasicString(int start) {
        if (input.startsWith("\"\"\"", start)) {
            return scanMultilineBasicString(start);
        }
        pos = start + 1;
        int contentStart = pos;
        boolean escapes = false;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '"') {
                var content = Span.of(contentStart, pos);
                pos++ ;
                return new TomlToken.BasicString(span(start), content, false, escapes);
            }
            if (c == '\\') {
                escapes = true;
                pos++ ;
                if (!isAtEnd() && (peek() == '"' || peek() == '\\')) {
                    pos++ ;
                }
                continue;
            }
            if (c == '\n' || c == '\r') {
                throw error(ParseErrorKind.UNTERMINATED_STRING, start, pos);
            }
            checkStringChar(c);
            pos++ ;
        }
        throw error(ParseErrorKind.UNTERMINATED_STRING, start, pos);
    }

    private TomlToken scanMultilineBasicString(int start) {
        pos = start + 3;
        skipLeadingNewline();
        int contentStart = pos;
        boolean escapes = false;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '"' && input.startsWith("\"\"\"", pos)) {
                int contentEnd = closeMultiline('"');
                return new TomlToken.BasicString(span(start), Span.of(contentStart, contentEnd), true, escapes);
            }
            if (c == '\\') {
                escapes = true;
                pos++ ;
                if (!isAtEnd() && (peek() == '"' || peek() == '\\')) {
                    pos++ ;
                }
                continue;
            }
            checkMultilineChar(c);
            pos++ ;
        }
        throw error(ParseErrorKind.UNTERMINATED_STRING, start, pos);
    }

    private TomlToken scanLiteralString(int start) {
        if (input.startsWith("'''", start)) {
            return scanMultilineLiteralString(start);
        }
        pos = start + 1;
        int contentStart = pos;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\'') {
                var content = Span.of(contentStart, pos);
                pos++ ;
                return new TomlToken.LiteralString(span(start), content, false);
            }
            if (c == '\n' || c == '\r') {
                throw error(ParseErrorKind.UNTERMINATED_STRING, start, pos);
            }
            checkStringChar(c);
            pos++ ;
        }
        throw error(ParseErrorKind.UNTERMINATED_STRING, start, pos);
    }

    private TomlToken scanMultilineLiteralString(int start) {
        pos = start + 3;
        skipLeadingNewline();
        int contentStart = pos;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\'' && input.startsWith("'''", pos)) {
                int contentEnd = closeMultiline('\'');
                return new TomlToken.LiteralString(span(start), Span.of(contentStart, contentEnd), true);
            }
            checkMultilineChar(c);
            pos++ ;
        }
        throw error(ParseErrorKind.UNTERMINATED_STRING, start, pos);
    }

    /**
     * Consume a closing delimiter run. Up to two quotes right before the delimiter belong to the content.
     * Returns the end of the content.
     */
    private int closeMultiline(char quote) {
        int runStart = pos;
        while (!isAtEnd() && peek() == quote) {
            pos++ ;
        }
        int run = pos - runStart;
        if (run > 5) {
            throw error(ParseErrorKind.UNEXPECTED_CHARACTER, runStart + 5, pos);
        }
        return runStart + run - 3;
    }

    private void skipLeadingNewline() {
        if (input.startsWith("\n", pos)) {
            pos++ ;
        } else if (input.startsWith("\r\n", pos)) {
            pos += 2;
        }
    }

    private void checkStringChar(char c) {
        if (isControl(c) && c != '\t') {
            throw error(ParseErrorKind.UNEXPECTED_CHARACTER, pos, pos + 1);
        }
    }

    private void checkMultilineChar(char c) {
        if (c == '\n') {
            return;
        }
        if (c == '\r') {
            if (pos + 1 < input.length() && input.charAt(pos + 1) == '\n') {
                return;
            }
            throw error(ParseErrorKind.UNEXPECTED_CHARACTER, pos, pos + 1);
        }
        checkStringChar(c);
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t') {
                pos++ ;
            } else if (c == '#') {
                skipComment();
            } else {
                break;
            }
        }
    }

    // Leaves the terminating newline in place
    private void skipComment() {
        pos++ ;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n' || (c == '\r' && pos + 1 < input.length() && input.charAt(pos + 1) == '\n')) {
                return;
            }
            if (isControl(c) && c != '\t') {
                throw error(ParseErrorKind.UNEXPECTED_CHARACTER, pos, pos + 1);
            }
            pos++ ;
        }
    }

    private int wordEnd(int start) {
        int end = start;
        while (end < input.length() && isAsciiLetterOrDigit(input.charAt(end))) {
            end++ ;
        }
        return end == start
               ? start + Character.charCount(input.codePointAt(start))
               : end;
    }

    private boolean digits(int at, int count) {
        if (at + count > input.length()) {
            return false;
        }
        for (int i = at; i < at + count; i++) {
            if (!isDigit(input.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private boolean charIs(int at, char expected) {
        return at < input.length() && input.charAt(at) == expected;
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private Span span(int start) {
        return Span.of(start, pos);
    }

    private static TomlParseException error(ParseErrorKind kind, int start, int end) {
        return ParseError.of(kind, start, end)
                         .toException();
    }

    static boolean isBareKeyChar(char c) {
        return isAsciiLetterOrDigit(c) || c == '_' || c == '-';
    }

    private static boolean isAsciiLetterOrDigit(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isExponentMarker(char c) {
        return c == 'e' || c == 'E';
    }

    private static boolean isControl(char c) {
        return c < 0x20 || c == 0x7F;
    }

    private static boolean isWhitespaceOrNewline(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }
}
