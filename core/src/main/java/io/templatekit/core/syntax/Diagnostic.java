package io.templatekit.core.syntax;

import java.util.Objects;

/**
 * Caret-style rendering of an error located in template source.
 *
 * <p>Example output of {@link #format(String, String)}:
 * <pre>
 * error: Keyword "desc" doesn't exist
 *  --> oneline:1:1
 *   |
 * 1 | desc.first_line()
 *   | ^^^^
 *   |
 * </pre>
 *
 * @param message primary error message
 * @param span source span the caret underlines
 */
public record Diagnostic(String message, SourceSpan span) {

    public Diagnostic {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    /**
     * Formats this diagnostic against the source it was produced from.
     *
     * @param source the template source text
     * @param name optional template name shown in the location line, may be null
     * @return multi-line diagnostic text
     */
    public String format(String source, String name) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append("error: ").append(message).append('\n');

        var loc = span.start();
        int gutterWidth = String.valueOf(span.end().line()).length();
        sb.append(" ".repeat(gutterWidth)).append("--> ");
        if (name != null) {
            sb.append(name).append(':');
        }
        sb.append(loc.line()).append(':').append(loc.column()).append('\n');
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (int lineNum = loc.line(); lineNum <= span.end().line(); lineNum++) {
            if (lineNum > lines.length) {
                break;
            }
            String content = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
                    .append(" | ")
                    .append(content)
                    .append('\n');

            int startCol = lineNum == loc.line() ? loc.column() : 1;
            int endCol = lineNum == span.end().line() ? span.end().column() : content.length() + 1;
            sb.append(" ".repeat(gutterWidth))
                    .append(" | ")
                    .append(" ".repeat(startCol - 1))
                    .append("^".repeat(Math.max(1, endCol - startCol)))
                    .append('\n');
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        return sb.toString();
    }

    /** Single-line form: {@code line N, column M: message}. */
    public String formatSimple() {
        var loc = span.start();
        return "line " + loc.line() + ", column " + loc.column() + ": " + message;
    }
}
