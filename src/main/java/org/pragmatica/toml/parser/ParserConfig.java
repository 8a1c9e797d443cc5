package org.pragmatica.toml.parser;

/**
 * Parser configuration options.
 *
 * @param maxInputLength  longest accepted document, in characters (bytes for byte input)
 * @param maxNestingDepth deepest accepted nesting of arrays and inline tables
 */
public record ParserConfig(
    int maxInputLength,
    int maxNestingDepth
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        16 * 1024 * 1024,
        128
    );

    public ParserConfig {
        if (maxInputLength <= 0) {
            throw new IllegalArgumentException("maxInputLength must be positive, got " + maxInputLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
    }
}
