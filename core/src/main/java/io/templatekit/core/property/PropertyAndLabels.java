package io.templatekit.core.property;

import io.templatekit.core.template.LabelTemplate;
import io.templatekit.core.template.Template;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A property together with the style labels accumulated while resolving it, innermost first.
 * Immutable: {@link #withLabel(String)} returns a new instance.
 */
public record PropertyAndLabels<C>(Property<C> property, List<String> labels) {

    public PropertyAndLabels {
        Objects.requireNonNull(property, "property must not be null");
        labels = List.copyOf(labels);
    }

    public static <C> PropertyAndLabels<C> unlabeled(Property<C> property) {
        return new PropertyAndLabels<>(property, List.of());
    }

    /** A keyword property labelled with the keyword's own name. */
    public static <C> PropertyAndLabels<C> labeled(Property<C> property, String label) {
        return new PropertyAndLabels<>(property, List.of(label));
    }

    public PropertyAndLabels<C> withProperty(Property<C> replacement) {
        return new PropertyAndLabels<>(replacement, labels);
    }

    public PropertyAndLabels<C> withLabel(String label) {
        var extended = new ArrayList<>(labels);
        extended.add(label);
        return new PropertyAndLabels<>(property, extended);
    }

    /** Renders the property, wrapped in its labels when there are any. */
    public Template<C> intoTemplate() {
        Template<C> template = property.intoTemplate();
        if (labels.isEmpty()) {
            return template;
        }
        return new LabelTemplate<>(template, TemplateProperty.constant(labels));
    }
}
