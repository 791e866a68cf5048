package io.templatekit.core.error;

/**
 * Abstract base for all templatekit exceptions. Never thrown directly; use {@link
 * TemplateParseException} for template compilation failures and {@link SettingsLoadException} for
 * settings files.
 */
public abstract class TemplateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected TemplateException(String message, String source) {
        super(message);
        this.source = source;
    }

    protected TemplateException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
    }

    /**
     * The template name or settings path that was being loaded, or {@code null} for anonymous
     * templates compiled directly.
     */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
