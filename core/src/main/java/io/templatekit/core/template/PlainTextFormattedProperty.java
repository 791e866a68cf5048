package io.templatekit.core.template;

import io.templatekit.core.property.TemplateProperty;
import java.util.Objects;

/** Renders a template into a string, discarding its labels. */
public final class PlainTextFormattedProperty<C> implements TemplateProperty<C, String> {

    private final Template<C> template;

    public PlainTextFormattedProperty(Template<C> template) {
        this.template = Objects.requireNonNull(template, "template must not be null");
    }

    @Override
    public String extract(C context) {
        var formatter = new PlainTextFormatter();
        template.format(context, formatter);
        return formatter.text();
    }
}
