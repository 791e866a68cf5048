package io.templatekit.core.template;

import io.templatekit.core.property.TemplateProperty;
import io.templatekit.core.spi.Formattable;
import io.templatekit.core.spi.Formatter;
import java.util.Objects;

/**
 * Renders a property's value in its display form: {@link Formattable} values format themselves,
 * everything else is written with {@code toString()}.
 */
public final class FormattablePropertyTemplate<C, O> implements Template<C> {

    private final TemplateProperty<C, O> property;

    public FormattablePropertyTemplate(TemplateProperty<C, O> property) {
        this.property = Objects.requireNonNull(property, "property must not be null");
    }

    @Override
    public void format(C context, Formatter formatter) {
        O value = property.extract(context);
        if (value instanceof Formattable formattable) {
            formattable.format(formatter);
        } else {
            formatter.write(String.valueOf(value));
        }
    }
}
