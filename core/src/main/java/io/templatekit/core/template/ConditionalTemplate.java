package io.templatekit.core.template;

import io.templatekit.core.property.TemplateProperty;
import io.templatekit.core.spi.Formatter;
import java.util.Objects;

/** Chooses between two branches per context. A missing false branch renders nothing. */
public final class ConditionalTemplate<C> implements Template<C> {

    private final TemplateProperty<C, Boolean> condition;
    private final Template<C> trueTemplate;
    private final Template<C> falseTemplate;

    /**
     * @param condition evaluated once per render
     * @param trueTemplate rendered when the condition holds
     * @param falseTemplate rendered otherwise, or {@code null} for no output
     */
    public ConditionalTemplate(
            TemplateProperty<C, Boolean> condition, Template<C> trueTemplate, Template<C> falseTemplate) {
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
        this.trueTemplate = Objects.requireNonNull(trueTemplate, "trueTemplate must not be null");
        this.falseTemplate = falseTemplate;
    }

    @Override
    public void format(C context, Formatter formatter) {
        if (Boolean.TRUE.equals(condition.extract(context))) {
            trueTemplate.format(context, formatter);
        } else if (falseTemplate != null) {
            falseTemplate.format(context, formatter);
        }
    }
}
