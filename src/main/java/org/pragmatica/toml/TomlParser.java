package org.pragmatica.toml;

import org.pragmatica.toml.error.ParseError;
import org.pragmatica.toml.error.ParseErrorKind;
import org.pragmatica.toml.error.TomlParseException;
import org.pragmatica.toml.parser.DocumentParser;
import org.pragmatica.toml.parser.ParseResult;
import org.pragmatica.toml.parser.ParserConfig;
import org.pragmatica.toml.tree.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Entry point for parsing TOML documents.
 *
 * <p>Example usage:
 * <pre>{@code
 * var toml = TomlParser.parse("""
 *     [package]
 *     name = "demo"
 *     """).unwrap();
 *
 * var name = toml.getTable("package")
 *                .flatMap(pkg -> pkg.getString("name"))
 *                .or("unnamed");
 * }</pre>
 *
 * <p>Each call is independent; nothing is shared between parses.
 */
public final class TomlParser {
    private static final Logger log = LoggerFactory.getLogger(TomlParser.class);

    private TomlParser() {}

    /**
     * Parse a document with the default configuration.
     */
    public static ParseResult parse(String source) {
        return parse(source, ParserConfig.DEFAULT);
    }

    /**
     * Parse a document with custom configuration.
     */
    public static ParseResult parse(String source, ParserConfig config) {
        if (source.length() > config.maxInputLength()) {
            return failed(ParseError.of(ParseErrorKind.INPUT_TOO_LARGE, config.maxInputLength(), source.length()));
        }
        return parseDocument(source, config, UnaryOperator.identity());
    }

    /**
     * Parse UTF-8 encoded bytes with the default configuration.
     */
    public static ParseResult parse(byte[] bytes) {
        return parse(bytes, ParserConfig.DEFAULT);
    }

    /**
     * Parse UTF-8 encoded bytes. Malformed input fails with {@link ParseErrorKind#INVALID_ENCODING}.
     * Every error span is a byte offset range into {@code bytes}, and the input length limit counts bytes.
     */
    public static ParseResult parse(byte[] bytes, ParserConfig config) {
        if (bytes.length > config.maxInputLength()) {
            return failed(ParseError.of(ParseErrorKind.INPUT_TOO_LARGE, config.maxInputLength(), bytes.length));
        }
        var decoder = StandardCharsets.UTF_8.newDecoder()
                                            .onMalformedInput(CodingErrorAction.REPORT)
                                            .onUnmappableCharacter(CodingErrorAction.REPORT);
        var in = ByteBuffer.wrap(bytes);
        // UTF-8 never decodes to more chars than it has bytes
        var out = CharBuffer.allocate(bytes.length);

        var result = decoder.decode(in, out, true);
        if (!result.isError()) {
            result = decoder.flush(out);
        }
        if (result.isError()) {
            return failed(encodingError(in, result));
        }
        var source = out.flip()
                        .toString();
        return parseDocument(source, config, error -> inBytes(source, error));
    }

    private static ParseResult parseDocument(String source, ParserConfig config, UnaryOperator<ParseError> locate) {
        long started = System.nanoTime();
        try {
            var document = new Toml(source, DocumentParser.parse(source, config));
            log.debug("Parsed {} chars into {} top-level keys in {} us",
                      source.length(),
                      document.size(),
                      TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - started));
            return ParseResult.success(document);
        } catch (TomlParseException e) {
            return failed(locate.apply(e.error()));
        }
    }

    private static ParseError encodingError(ByteBuffer in, CoderResult result) {
        int start = in.position();
        return ParseError.of(ParseErrorKind.INVALID_ENCODING, Span.of(start, start + result.length()));
    }

    private static ParseError inBytes(String source, ParseError error) {
        int charStart = Math.min(error.span().start(), source.length());
        int charEnd = Math.min(error.span().end(), source.length());
        int start = utf8Length(source, 0, charStart);
        return ParseError.of(error.kind(), start, start + utf8Length(source, charStart, charEnd));
    }

    // Decoded input is well formed, so every surrogate is half of a four-byte pair
    private static int utf8Length(String source, int from, int to) {
        int length = 0;
        for (int i = from; i < to; i++) {
            char c = source.charAt(i);
            if (c < 0x80) {
                length += 1;
            } else if (c < 0x800 || Character.isSurrogate(c)) {
                length += 2;
            } else {
                length += 3;
            }
        }
        return length;
    }

    private static ParseResult failed(ParseError error) {
        log.debug("Parse failed: {}", error.message());
        return ParseResult.failure(error);
    }

    /**
     * Create a builder for parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxInputLength = ParserConfig.DEFAULT.maxInputLength();
        private int maxNestingDepth = ParserConfig.DEFAULT.maxNestingDepth();

        private Builder() {}

        public Builder maxInputLength(int length) {
            this.maxInputLength = length;
            return this;
        }

        public Builder maxNestingDepth(int depth) {
            this.maxNestingDepth = depth;
            return this;
        }

        public ParserConfig config() {
            return new ParserConfig(maxInputLength, maxNestingDepth);
        }

        public ParseResult parse(String source) {
            return TomlParser.parse(source, config());
        }

        public ParseResult parse(byte[] bytes) {
            return TomlParser.parse(bytes, config());
        }
    }
}
