package io.templatekit.core.syntax;

/**
 * A position in template source text. {@code line} and {@code column} are 1-based; {@code offset}
 * is the 0-based UTF-16 index into the source string.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public SourceLocation {
        if (line < 1 || column < 1 || offset < 0) {
            throw new IllegalArgumentException(
                    "Invalid source location: line=" + line + ", column=" + column + ", offset=" + offset);
        }
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
