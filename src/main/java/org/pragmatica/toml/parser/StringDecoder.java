package org.pragmatica.toml.parser;

import org.pragmatica.toml.error.ParseError;
import org.pragmatica.toml.error.ParseErrorKind;
import org.pragmatica.toml.error.TomlParseException;
import org.pragmatica.toml.tree.Span;
import org.pragmatica.toml.tree.TomlText;

/**
 * Turns string tokens into text. Copies only when a basic string contains escapes.
 */
final class StringDecoder {
    private StringDecoder() {}

    static TomlText decode(String source, TomlToken token) {
        if (token instanceof TomlToken.LiteralString literal) {
            return TomlText.borrowed(source, literal.content());
        }
        if (token instanceof TomlToken.BasicString basic) {
            return basic.hasEscapes()
                   ? TomlText.owned(unescape(source, basic.content(), basic.multiline()))
                   : TomlText.borrowed(source, basic.content());
        }
        throw new IllegalArgumentException("Not a string token: " + token);
    }

    /**
     * Resolve escape sequences in {@code source[content]}.
     */
    static String unescape(String source, Span content, boolean multiline) {
        var sb = new StringBuilder(content.length());
        int end = content.end();
        int i = content.start();

        while (i < end) {
            int backslash = source.indexOf('\\', i);
            if (backslash < 0 || backslash >= end) {
                sb.append(source, i, end);
                break;
            }
            sb.append(source, i, backslash);
            i = decodeEscape(source, backslash, end, multiline, sb);
        }
        return sb.toString();
    }

    // Returns the position right after the escape
    private static int decodeEscape(String source, int backslash, int end, boolean multiline, StringBuilder sb) {
        int at = backslash + 1;
        if (at >= end) {
            throw error(ParseErrorKind.INVALID_ESCAPE, backslash, at);
        }
        char c = source.charAt(at);
        switch (c) {
            case 'b':
                sb.append('\b');
                return at + 1;
            case 't':
                sb.append('\t');
                return at + 1;
            case 'n':
                sb.append('\n');
                return at + 1;
            case 'f':
                sb.append('\f');
                return at + 1;
            case 'r':
                sb.append('\r');
                return at + 1;
            case '"':
                sb.append('"');
                return at + 1;
            case '\\':
                sb.append('\\');
                return at + 1;
            case 'u':
                return decodeUnicode(source, backslash, end, 4, sb);
            case 'U':
                return decodeUnicode(source, backslash, end, 8, sb);
            default:
                if (multiline) {
                    int resumed = skipLineContinuation(source, at, end);
                    if (resumed > 0) {
                        return resumed;
                    }
                }
                throw error(ParseErrorKind.INVALID_ESCAPE, backslash, at + 1);
        }
    }

    private static int decodeUnicode(String source, int backslash, int end, int digits, StringBuilder sb) {
        int from = backslash + 2;
        int to = from + digits;
        if (to > end) {
            throw error(ParseErrorKind.INVALID_UNICODE_SCALAR, backslash, end);
        }
        long scalar = 0;
        for (int i = from; i < to; i++) {
            int digit = hexValue(source.charAt(i));
            if (digit < 0) {
                throw error(ParseErrorKind.INVALID_UNICODE_SCALAR, backslash, to);
            }
            scalar = scalar * 16 + digit;
        }
        if (scalar > Character.MAX_CODE_POINT || (scalar >= Character.MIN_SURROGATE && scalar <= Character.MAX_SURROGATE)) {
            throw error(ParseErrorKind.INVALID_UNICODE_SCALAR, backslash, to);
        }
        sb.appendCodePoint((int) scalar);
        return to;
    }

    /**
     * Line-ending backslash: optional spaces/tabs, a newline, then every following whitespace and newline.
     * Returns -1 when the backslash does not end the line.
     */
    private static int skipLineContinuation(String source, int at, int end) {
        int i = at;
        while (i < end && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
            i++ ;
        }
        if (i < end && source.charAt(i) == '\n') {
            i++ ;
        } else if (i + 1 < end && source.charAt(i) == '\r' && source.charAt(i + 1) == '\n') {
            i += 2;
        } else {
            return -1;
        }
        while (i < end && isWhitespaceOrNewline(source.charAt(i))) {
            i++ ;
        }
        return i;
    }

    private static boolean isWhitespaceOrNewline(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    private static TomlParseException error(ParseErrorKind kind, int start, int end) {
        return ParseError.of(kind, start, end)
                         .toException();
    }
}
