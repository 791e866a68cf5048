package io.templatekit.core.error;

/** Thrown when a settings file is missing, unreadable or structurally invalid. */
public final class SettingsLoadException extends TemplateException {

    private static final long serialVersionUID = 1L;

    public SettingsLoadException(String message, String source) {
        super(message, source);
    }

    public SettingsLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
