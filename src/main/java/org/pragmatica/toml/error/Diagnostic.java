package org.pragmatica.toml.error;

import org.pragmatica.toml.tree.SourceLocation;
import org.pragmatica.toml.tree.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Rich diagnostic message for parse errors.
 *
 * <p>Example output:
 * <pre>
 * error[DUPLICATE_KEY]: key is already defined
 *   --> Cargo.toml:3:1
 *    |
 *  3 | name = "y"
 *    | ^^^^ redefined here
 *    |
 * </pre>
 *
 * @param code    Optional error code
 * @param message Primary error message
 * @param span    Source span where the error occurred
 * @param labels  Labeled spans, drawn with ^^^ under the source line
 */
public record Diagnostic(
    String code,
    String message,
    Span span,
    List<Label> labels
) {
    /**
     * A labeled span.
     */
    public record Label(Span span, String message) {}

    public static Diagnostic error(String code, String message, Span span) {
        return new Diagnostic(code, message, span, List.of());
    }

    /**
     * Add a primary label at the diagnostic span.
     */
    public Diagnostic withLabel(String labelMessage) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(new Label(span, labelMessage));
        return new Diagnostic(code, message, span, List.copyOf(newLabels));
    }

    /**
     * Format this diagnostic against the source it refers to.
     *
     * @param source   The source text
     * @param filename Optional filename for display
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var start = SourceLocation.of(source, span.start());

        sb.append("error");
        if (code != null) {
            sb.append("[").append(code).append("]");
        }
        sb.append(": ").append(message).append("\n");

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(start.line()).append(":").append(start.column()).append("\n");

        int minLine = start.line();
        int maxLine = SourceLocation.of(source, span.end()).line();
        for (var label : labels) {
            minLine = Math.min(minLine, SourceLocation.of(source, label.span().start()).line());
            maxLine = Math.max(maxLine, SourceLocation.of(source, label.span().end()).line());
        }

        int gutterWidth = String.valueOf(maxLine).length();
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) continue;

            String lineContent = stripCarriageReturn(lines[lineNum - 1]);
            String lineNumStr = String.format("%" + gutterWidth + "d", lineNum);
            sb.append(lineNumStr).append(" | ").append(lineContent).append("\n");

            var lineLabels = labelsOnLine(source, lineNum);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutterWidth)).append(" | ");
                sb.append(formatUnderlines(source, lineNum, lineContent, lineLabels));
                sb.append("\n");
            }
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        return sb.toString();
    }

    private List<Label> labelsOnLine(String source, int lineNum) {
        var result = new ArrayList<Label>();
        if (labels.isEmpty() && covers(source, span, lineNum)) {
            result.add(new Label(span, ""));
        }
        for (var label : labels) {
            if (covers(source, label.span(), lineNum)) {
                result.add(label);
            }
        }
        return result;
    }

    private static boolean covers(String source, Span labelSpan, int lineNum) {
        return SourceLocation.of(source, labelSpan.start()).line() <= lineNum
               && SourceLocation.of(source, labelSpan.end()).line() >= lineNum;
    }

    private static String formatUnderlines(String source, int lineNum, String lineContent, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int currentCol = 1;

        var sorted = lineLabels.stream()
                               .sorted((a, b) -> Integer.compare(a.span().start(), b.span().start()))
                               .toList();

        for (var label : sorted) {
            var labelStart = SourceLocation.of(source, label.span().start());
            var labelEnd = SourceLocation.of(source, label.span().end());
            int startCol = labelStart.line() == lineNum ? labelStart.column() : 1;
            int endCol = labelEnd.line() == lineNum ? labelEnd.column() : lineContent.length() + 1;

            while (currentCol < startCol) {
                sb.append(" ");
                currentCol++;
            }

            int underlineLen = Math.max(1, endCol - startCol);
            sb.append("^".repeat(underlineLen));
            currentCol += underlineLen;

            if (!label.message().isEmpty()) {
                sb.append(" ").append(label.message());
            }
        }
        return sb.toString();
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
