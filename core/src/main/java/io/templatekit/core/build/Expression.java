package io.templatekit.core.build;

import io.templatekit.core.property.PropertyAndLabels;
import io.templatekit.core.property.TemplateProperty;
import io.templatekit.core.template.PlainTextFormattedProperty;
import io.templatekit.core.template.Template;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of building one AST node: either a typed property, which can take methods and be
 * coerced, or a template, which only renders.
 */
public sealed interface Expression<C> {

    Optional<TemplateProperty<C, Boolean>> tryIntoBoolean();

    Optional<TemplateProperty<C, Long>> tryIntoInteger();

    TemplateProperty<C, String> intoPlainText();

    Template<C> intoTemplate();

    record PropertyExpression<C>(PropertyAndLabels<C> property) implements Expression<C> {

        public PropertyExpression {
            Objects.requireNonNull(property, "property must not be null");
        }

        @Override
        public Optional<TemplateProperty<C, Boolean>> tryIntoBoolean() {
            return property.property().tryIntoBoolean();
        }

        @Override
        public Optional<TemplateProperty<C, Long>> tryIntoInteger() {
            return property.property().tryIntoInteger();
        }

        @Override
        public TemplateProperty<C, String> intoPlainText() {
            return property.property().intoPlainText();
        }

        @Override
        public Template<C> intoTemplate() {
            return property.intoTemplate();
        }
    }

    record TemplateExpression<C>(Template<C> template) implements Expression<C> {

        public TemplateExpression {
            Objects.requireNonNull(template, "template must not be null");
        }

        @Override
        public Optional<TemplateProperty<C, Boolean>> tryIntoBoolean() {
            return Optional.empty();
        }

        @Override
        public Optional<TemplateProperty<C, Long>> tryIntoInteger() {
            return Optional.empty();
        }

        @Override
        public TemplateProperty<C, String> intoPlainText() {
            return new PlainTextFormattedProperty<>(template);
        }

        @Override
        public Template<C> intoTemplate() {
            return template;
        }
    }
}
