package io.templatekit.core.error;

import io.templatekit.core.syntax.Diagnostic;
import io.templatekit.core.syntax.SourceSpan;
import java.util.Objects;

/**
 * Thrown when template source fails to compile, either because it does not match the grammar or
 * because the semantic pass rejects it (unknown names, wrong arity, wrong argument type).
 * Compilation is fail-fast, so exactly one of these describes the first problem found.
 *
 * <p>The message has the form {@code line N, column M: <description>}.
 */
public final class TemplateParseException extends TemplateException {

    private static final long serialVersionUID = 1L;

    private final transient TemplateParseErrorKind kind;
    private final transient SourceSpan span;

    public TemplateParseException(TemplateParseErrorKind kind, SourceSpan span) {
        this(kind, span, null, null);
    }

    public TemplateParseException(TemplateParseErrorKind kind, SourceSpan span, Throwable cause) {
        this(kind, span, cause, null);
    }

    private TemplateParseException(TemplateParseErrorKind kind, SourceSpan span, Throwable cause, String source) {
        super(describe(kind, span), cause, source);
        this.kind = kind;
        this.span = span;
    }

    private static String describe(TemplateParseErrorKind kind, SourceSpan span) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(span, "span must not be null");
        return new Diagnostic(kind.message(), span).formatSimple();
    }

    /**
     * Returns a copy of this exception attributed to the named template. The copy keeps this
     * exception's cause and stack trace.
     */
    public TemplateParseException withSource(String source) {
        var copy = new TemplateParseException(kind, span, getCause(), source);
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public TemplateParseErrorKind kind() {
        return kind;
    }

    public SourceSpan span() {
        return span;
    }

    /** Caret-style diagnostic for this error; format it against the template text. */
    public Diagnostic diagnostic() {
        return new Diagnostic(kind.message(), span);
    }
}
