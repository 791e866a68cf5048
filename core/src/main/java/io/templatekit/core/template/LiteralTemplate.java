package io.templatekit.core.template;

import io.templatekit.core.property.TemplateProperty;
import io.templatekit.core.spi.Formatter;
import java.util.Objects;

/**
 * Fixed text. Serves both as a template and as a constant string property, so a string literal
 * renders without going through a property extraction.
 */
public final class LiteralTemplate<C> implements Template<C>, TemplateProperty<C, String> {

    private final String text;

    public LiteralTemplate(String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    public String text() {
        return text;
    }

    @Override
    public void format(C context, Formatter formatter) {
        formatter.write(text);
    }

    @Override
    public String extract(C context) {
        return text;
    }

    @Override
    public String toString() {
        return "Literal[" + text + "]";
    }
}
