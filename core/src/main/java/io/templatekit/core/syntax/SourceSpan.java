package io.templatekit.core.syntax;

import java.util.Objects;

/** A half-open range {@code [start, end)} of template source text. */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public SourceSpan {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.offset() < start.offset()) {
            throw new IllegalArgumentException("Span end " + end + " precedes start " + start);
        }
    }

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    /** An empty span positioned at {@code location}. */
    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    /** Returns the text this span covers in {@code source}. */
    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
