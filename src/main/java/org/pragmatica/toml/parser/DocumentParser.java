package org.pragmatica.toml.parser;

import org.pragmatica.toml.error.ParseError;
import org.pragmatica.toml.error.ParseErrorKind;
import org.pragmatica.toml.error.TomlParseException;
import org.pragmatica.toml.tree.Key;
import org.pragmatica.toml.tree.Span;
import org.pragmatica.toml.tree.TableTree;
import org.pragmatica.toml.tree.TomlArray;
import org.pragmatica.toml.tree.TomlBoolean;
import org.pragmatica.toml.tree.TomlDateTime;
import org.pragmatica.toml.tree.TomlString;
import org.pragmatica.toml.tree.TomlTable;
import org.pragmatica.toml.tree.TomlText;
import org.pragmatica.toml.tree.TomlValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser over {@link TomlLexer} tokens.
 *
 * <p>Builds the document's table tree in one pass and stops at the first error, which is thrown
 * as a {@link TomlParseException}.
 */
public final class DocumentParser {
    private static final Logger log = LoggerFactory.getLogger(DocumentParser.class);

    private final String source;
    private final ParserConfig config;
    private final TomlLexer lexer;
    private final TableTree tree = new TableTree();
    private final NumberDecoder numbers = new NumberDecoder();
    private TomlTable current;

    private record KeyPath(List<Key> keys, TomlToken terminator) {}

    private DocumentParser(String source, ParserConfig config) {
        this.source = source;
        this.config = config;
        this.lexer = new TomlLexer(source);
        this.current = tree.root();
    }

    /**
     * Parse a whole document into its root table.
     *
     * @throws TomlParseException on the first syntax or structure error
     */
    public static TomlTable parse(String source, ParserConfig config) {
        return new DocumentParser(source, config).parseDocument();
    }

    private TomlTable parseDocument() {
        while (true) {
            var token = lexer.next(TomlLexer.Mode.KEY);
            if (token instanceof TomlToken.Eof) {
                return tree.root();
            }
            if (token instanceof TomlToken.Newline) {
                continue;
            }
            if (token instanceof TomlToken.LBracket open) {
                parseHeader(open);
            } else {
                parseKeyValue(token);
            }
            lexer.nextLineEnd();
        }
    }

    private void parseHeader(TomlToken.LBracket open) {
        var first = lexer.next(TomlLexer.Mode.KEY);
        boolean arrayHeader = first instanceof TomlToken.LBracket inner && inner.span()
                                                                               .start() == open.span()
                                                                                               .end();
        if (arrayHeader) {
            first = lexer.next(TomlLexer.Mode.KEY);
        }
        var path = parseKeyPath(first);
        var close = expectClosingBracket(path.terminator());

        if (arrayHeader) {
            var second = lexer.next(TomlLexer.Mode.KEY);
            if (!(second instanceof TomlToken.RBracket) || second.span()
                                                                 .start() != close.span()
                                                                                  .end()) {
                throw error(second instanceof TomlToken.Eof
                            ? ParseErrorKind.UNEXPECTED_END_OF_INPUT
                            : ParseErrorKind.UNCLOSED_BRACKET,
                            second.span());
            }
            log.trace("Array of tables header [[{}]] at {}", path.keys(), open.span());
            current = tree.appendArrayTable(path.keys());
        } else {
            log.trace("Table header [{}] at {}", path.keys(), open.span());
            current = tree.openTable(path.keys());
        }
    }

    private TomlToken expectClosingBracket(TomlToken token) {
        if (token instanceof TomlToken.RBracket) {
            return token;
        }
        throw error(token instanceof TomlToken.Eof
                    ? ParseErrorKind.UNEXPECTED_END_OF_INPUT
                    : ParseErrorKind.UNCLOSED_BRACKET,
                    token.span());
    }

    private void parseKeyValue(TomlToken first) {
        var path = parseKeyPath(first);
        var value = parseAssignedValue(path.terminator(), 1);
        tree.assign(current, path.keys(), value);
    }

    private TomlValue parseAssignedValue(TomlToken terminator, int depth) {
        if (terminator instanceof TomlToken.Equals) {
            return parseValue(lexer.next(TomlLexer.Mode.VALUE), depth);
        }
        throw error(terminator instanceof TomlToken.Eof
                    ? ParseErrorKind.UNEXPECTED_END_OF_INPUT
                    : ParseErrorKind.EXPECTED_EQUALS,
                    terminator.span());
    }

    /**
     * Read {@code key(.key)*} starting at {@code first}. The token after the last segment is returned
     * as the terminator.
     */
    private KeyPath parseKeyPath(TomlToken first) {
        var keys = new ArrayList<Key>();
        var token = first;
        while (true) {
            keys.add(toKey(token));
            token = lexer.next(TomlLexer.Mode.KEY);
            if (!(token instanceof TomlToken.Dot)) {
                return new KeyPath(keys, token);
            }
            token = lexer.next(TomlLexer.Mode.KEY);
        }
    }

    private Key toKey(TomlToken token) {
        if (token instanceof TomlToken.BareKey bare) {
            return Key.of(bare.span()
                              .extract(source), bare.span());
        }
        if (token instanceof TomlToken.BasicString basic && !basic.multiline()) {
            return Key.of(StringDecoder.decode(source, basic)
                                       .toString(), basic.span());
        }
        if (token instanceof TomlToken.LiteralString literal && !literal.multiline()) {
            return Key.of(literal.content()
                                 .extract(source), literal.span());
        }
        throw error(token instanceof TomlToken.Eof
                    ? ParseErrorKind.UNEXPECTED_END_OF_INPUT
                    : ParseErrorKind.EXPECTED_KEY,
                    token.span());
    }

    private TomlValue parseValue(TomlToken token, int depth) {
        if (token instanceof TomlToken.BasicString || token instanceof TomlToken.LiteralString) {
            return new TomlString(StringDecoder.decode(source, token));
        }
        if (token instanceof TomlToken.Number number) {
            return numbers.decode(source, number);
        }
        if (token instanceof TomlToken.Bool bool) {
            return TomlBoolean.of(bool.value());
        }
        if (token instanceof TomlToken.DateTime dateTime) {
            return new TomlDateTime(dateTime.kind(), TomlText.borrowed(source, dateTime.span()));
        }
        if (token instanceof TomlToken.LBracket open) {
            checkDepth(open, depth);
            return parseArray(depth);
        }
        if (token instanceof TomlToken.LBrace open) {
            checkDepth(open, depth);
            return parseInlineTable(depth);
        }
        throw error(token instanceof TomlToken.Eof
                    ? ParseErrorKind.UNEXPECTED_END_OF_INPUT
                    : ParseErrorKind.EXPECTED_VALUE,
                    token.span());
    }

    private void checkDepth(TomlToken open, int depth) {
        if (depth > config.maxNestingDepth()) {
            throw error(ParseErrorKind.NESTING_TOO_DEEP, open.span());
        }
    }

    // Newlines and comments may appear anywhere between elements
    private TomlArray parseArray(int depth) {
        var values = new ArrayList<TomlValue>();
        var token = nextSkippingNewlines();

        while (!(token instanceof TomlToken.RBracket)) {
            if (token instanceof TomlToken.Eof) {
                throw error(ParseErrorKind.UNCLOSED_BRACKET, token.span());
            }
            values.add(parseValue(token, depth + 1));

            var separator = nextSkippingNewlines();
            if (separator instanceof TomlToken.RBracket) {
                break;
            }
            if (separator instanceof TomlToken.Eof) {
                throw error(ParseErrorKind.UNCLOSED_BRACKET, separator.span());
            }
            if (!(separator instanceof TomlToken.Comma)) {
                throw error(ParseErrorKind.MISSING_COMMA, separator.span());
            }
            token = nextSkippingNewlines();
        }
        return TomlArray.of(values);
    }

    private TomlToken nextSkippingNewlines() {
        var token = lexer.next(TomlLexer.Mode.VALUE);
        while (token instanceof TomlToken.Newline) {
            token = lexer.next(TomlLexer.Mode.VALUE);
        }
        return token;
    }

    // Single line, no trailing comma
    private TomlTable parseInlineTable(int depth) {
        var table = tree.inlineTable();
        var token = lexer.next(TomlLexer.Mode.KEY);
        if (token instanceof TomlToken.RBrace) {
            return table;
        }
        while (true) {
            checkInlineOpen(token);
            var path = parseKeyPath(token);
            checkInlineOpen(path.terminator());
            var value = parseAssignedValue(path.terminator(), depth + 1);
            tree.assign(table, path.keys(), value);

            var separator = lexer.next(TomlLexer.Mode.KEY);
            if (separator instanceof TomlToken.RBrace) {
                return table;
            }
            checkInlineOpen(separator);
            if (!(separator instanceof TomlToken.Comma)) {
                throw error(ParseErrorKind.MISSING_COMMA, separator.span());
            }
            token = lexer.next(TomlLexer.Mode.KEY);
        }
    }

    private static void checkInlineOpen(TomlToken token) {
        if (token instanceof TomlToken.Newline || token instanceof TomlToken.Eof) {
            throw error(ParseErrorKind.UNCLOSED_BRACKET, token.span());
        }
    }

    private static TomlParseException error(ParseErrorKind kind, Span span) {
        return ParseError.of(kind, span)
                         .toException();
    }
}
