package io.templatekit.core.template;

import io.templatekit.core.property.TemplateProperty;
import io.templatekit.core.spi.Formatter;
import java.util.List;
import java.util.Objects;

/**
 * Renders its content with labels pushed onto the formatter's stack. The labels are evaluated
 * against each context, so they may be computed by the template itself.
 */
public final class LabelTemplate<C> implements Template<C> {

    private final Template<C> content;
    private final TemplateProperty<C, List<String>> labels;

    public LabelTemplate(Template<C> content, TemplateProperty<C, List<String>> labels) {
        this.content = Objects.requireNonNull(content, "content must not be null");
        this.labels = Objects.requireNonNull(labels, "labels must not be null");
    }

    @Override
    public void format(C context, Formatter formatter) {
        List<String> current = labels.extract(context);
        for (String label : current) {
            formatter.pushLabel(label);
        }
        content.format(context, formatter);
        for (int i = 0; i < current.size(); i++) {
            formatter.popLabel();
        }
    }
}
