package org.pragmatica.toml.parser;

import org.pragmatica.toml.error.ParseError;
import org.pragmatica.toml.error.ParseErrorKind;
import org.pragmatica.toml.error.TomlParseException;
import org.pragmatica.toml.tree.Span;
import org.pragmatica.toml.tree.TomlFloat;
import org.pragmatica.toml.tree.TomlInteger;
import org.pragmatica.toml.tree.TomlValue;

import java.nio.CharBuffer;

/**
 * Decodes number tokens into integers or floats.
 *
 * <p>Digits are copied, without underscores, into a fixed scratch buffer owned by one parse. Literals
 * that do not fit the buffer are rejected.
 */
final class NumberDecoder {
    static final int MAX_LITERAL_LENGTH = 768;

    private final char[] scratch = new char[MAX_LITERAL_LENGTH];
    private final CharBuffer view = CharBuffer.wrap(scratch);
    private int length;

    TomlValue decode(String source, TomlToken.Number token) {
        var span = token.span();
        int end = span.end();
        int i = span.start();
        boolean negative = false;
        length = 0;

        char first = source.charAt(i);
        if (first == '+' || first == '-') {
            negative = first == '-';
            i++ ;
        }
        if (source.startsWith("inf", i) && i + 3 == end) {
            return TomlFloat.of(negative
                                ? Double.NEGATIVE_INFINITY
                                : Double.POSITIVE_INFINITY);
        }
        if (source.startsWith("nan", i) && i + 3 == end) {
            return TomlFloat.of(Double.NaN);
        }
        if (negative) {
            append('-', span);
        }
        int radix = radixOf(source, i, end);
        if (radix != 10) {
            return decodePrefixed(source, i + 2, end, radix, span);
        }
        return decodeDecimal(source, i, end, span);
    }

    private static int radixOf(String source, int at, int end) {
        if (at + 1 >= end || source.charAt(at) != '0') {
            return 10;
        }
        switch (source.charAt(at + 1)) {
            case 'x':
                return 16;
            case 'o':
                return 8;
            case 'b':
                return 2;
            default:
                return 10;
        }
    }

    private TomlValue decodePrefixed(String source, int from, int end, int radix, Span span) {
        if (from >= end) {
            throw error(ParseErrorKind.INVALID_NUMBER, span);
        }
        for (int i = from; i < end; i++) {
            char c = source.charAt(i);
            if (c == '_') {
                checkUnderscore(source, i, from, end, radix, span);
                continue;
            }
            if (Character.digit(c, radix) < 0) {
                throw error(ParseErrorKind.INVALID_NUMBER, span);
            }
            append(c, span);
        }
        return parseInteger(radix, span);
    }

    // int-part [ '.' digits ] [ ('e' | 'E') [sign] digits ]
    private TomlValue decodeDecimal(String source, int from, int end, Span span) {
        int i = scanDigits(source, from, end, span);
        int intDigits = i - from;
        if (intDigits == 0) {
            throw error(ParseErrorKind.INVALID_NUMBER, span);
        }
        if (source.charAt(from) == '0' && intDigits > 1) {
            throw error(ParseErrorKind.LEADING_ZERO, span);
        }
        boolean isFloat = false;

        if (i < end && source.charAt(i) == '.') {
            isFloat = true;
            append('.', span);
            int fracStart = i + 1;
            i = scanDigits(source, fracStart, end, span);
            if (i == fracStart) {
                throw error(ParseErrorKind.INVALID_NUMBER, span);
            }
        }
        if (i < end && (source.charAt(i) == 'e' || source.charAt(i) == 'E')) {
            isFloat = true;
            append('e', span);
            i++ ;
            if (i < end && (source.charAt(i) == '+' || source.charAt(i) == '-')) {
                append(source.charAt(i), span);
                i++ ;
            }
            int expStart = i;
            i = scanDigits(source, expStart, end, span);
            if (i == expStart) {
                throw error(ParseErrorKind.INVALID_NUMBER, span);
            }
        }
        if (i != end) {
            throw error(ParseErrorKind.INVALID_NUMBER, span);
        }
        return isFloat
               ? parseFloat(span)
               : parseInteger(10, span);
    }

    /**
     * Copy a run of decimal digits and inner underscores. Returns the position after the run.
     */
    private int scanDigits(String source, int from, int end, Span span) {
        int i = from;
        while (i < end) {
            char c = source.charAt(i);
            if (c == '_') {
                checkUnderscore(source, i, from, end, 10, span);
            } else if (c >= '0' && c <= '9') {
                append(c, span);
            } else {
                break;
            }
            i++ ;
        }
        return i;
    }

    // An underscore must sit between two digits
    private static void checkUnderscore(String source, int at, int from, int end, int radix, Span span) {
        if (at == from || at + 1 >= end
            || Character.digit(source.charAt(at - 1), radix) < 0
            || Character.digit(source.charAt(at + 1), radix) < 0) {
            throw error(ParseErrorKind.INVALID_NUMBER, span);
        }
    }

    private TomlValue parseInteger(int radix, Span span) {
        try {
            return TomlInteger.of(Long.parseLong(view, 0, length, radix));
        } catch (NumberFormatException e) {
            throw error(ParseErrorKind.NUMBER_TOO_LARGE, span);
        }
    }

    private TomlValue parseFloat(Span span) {
        double value = Double.parseDouble(new String(scratch, 0, length));
        if (Double.isInfinite(value)) {
            throw error(ParseErrorKind.NUMBER_TOO_LARGE, span);
        }
        return TomlFloat.of(value);
    }

    private void append(char c, Span span) {
        if (length == scratch.length) {
            throw error(ParseErrorKind.INVALID_NUMBER, span);
        }
        scratch[length++] = c;
    }

    private static TomlParseException error(ParseErrorKind kind, Span span) {
        return ParseError.of(kind, span)
                         .toException();
    }
}
