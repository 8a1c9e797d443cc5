package org.pragmatica.toml.tree;

/**
 * A position in source text (line and column, both 1-based).
 * Computed on demand from an offset; only diagnostics need it.
 */
public record SourceLocation(int line, int column, int offset) {

    /**
     * Resolve an offset into a line/column pair. Offsets past the end clamp to the end of the source.
     */
    public static SourceLocation of(String source, int offset) {
        int limit = Math.min(offset, source.length());
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++ ;
                lineStart = i + 1;
            }
        }
        return new SourceLocation(line, limit - lineStart + 1, limit);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
