package io.templatekit.core.template;

import io.templatekit.core.spi.Formatter;
import java.util.List;

/** Renders each child in order with nothing in between. */
public final class ListTemplate<C> implements Template<C> {

    private final List<Template<C>> templates;

    public ListTemplate(List<Template<C>> templates) {
        this.templates = List.copyOf(templates);
    }

    @Override
    public void format(C context, Formatter formatter) {
        for (Template<C> template : templates) {
            template.format(context, formatter);
        }
    }
}
