package io.templatekit.core.property;

import io.templatekit.core.model.CommitOrChangeId;
import io.templatekit.core.model.ShortestIdPrefix;
import io.templatekit.core.model.Signature;
import io.templatekit.core.model.Timestamp;
import io.templatekit.core.template.FormattablePropertyTemplate;
import io.templatekit.core.template.LiteralTemplate;
import io.templatekit.core.template.PlainTextFormattedProperty;
import io.templatekit.core.template.Template;
import java.util.Objects;
import java.util.Optional;

/**
 * A typed template property: one variant per {@link ValueKind}, each wrapping a {@link
 * TemplateProperty} of the matching Java type.
 *
 * <p>The coercions defined here are the only ones the language has: String to Boolean (non-empty)
 * where a condition is required, and any value to plain text where a text argument is required.
 *
 * @param <C> context type
 */
public sealed interface Property<C> {

    ValueKind kind();

    TemplateProperty<C, ?> function();

    /** Boolean view: Boolean passes through, String is true when non-empty. */
    default Optional<TemplateProperty<C, Boolean>> tryIntoBoolean() {
        if (this instanceof BooleanValue<C> value) {
            return Optional.of(value.function());
        }
        if (this instanceof StringValue<C> value) {
            return Optional.of(value.function().map(s -> !s.isEmpty()));
        }
        return Optional.empty();
    }

    default Optional<TemplateProperty<C, Long>> tryIntoInteger() {
        if (this instanceof IntegerValue<C> value) {
            return Optional.of(value.function());
        }
        return Optional.empty();
    }

    /** String properties are used as-is; anything else is rendered and its text kept. */
    default TemplateProperty<C, String> intoPlainText() {
        if (this instanceof StringValue<C> value) {
            return value.function();
        }
        return new PlainTextFormattedProperty<>(intoTemplate());
    }

    /** Renders the value's display form. */
    default Template<C> intoTemplate() {
        return new FormattablePropertyTemplate<>(function());
    }

    static <C> Property<C> string(TemplateProperty<C, String> function) {
        return new StringValue<>(function);
    }

    static <C> Property<C> bool(TemplateProperty<C, Boolean> function) {
        return new BooleanValue<>(function);
    }

    static <C> Property<C> integer(TemplateProperty<C, Long> function) {
        return new IntegerValue<>(function);
    }

    static <C> Property<C> commitOrChangeId(TemplateProperty<C, CommitOrChangeId> function) {
        return new CommitOrChangeIdValue<>(function);
    }

    static <C> Property<C> shortestIdPrefix(TemplateProperty<C, ShortestIdPrefix> function) {
        return new ShortestIdPrefixValue<>(function);
    }

    static <C> Property<C> signature(TemplateProperty<C, Signature> function) {
        return new SignatureValue<>(function);
    }

    static <C> Property<C> timestamp(TemplateProperty<C, Timestamp> function) {
        return new TimestampValue<>(function);
    }

    record StringValue<C>(TemplateProperty<C, String> function) implements Property<C> {

        public StringValue {
            Objects.requireNonNull(function, "function must not be null");
        }

        @Override
        public ValueKind kind() {
            return ValueKind.STRING;
        }

        @Override
        public Template<C> intoTemplate() {
            if (function instanceof LiteralTemplate<C> literal) {
                return literal;
            }
            return Property.super.intoTemplate();
        }
    }

    record BooleanValue<C>(TemplateProperty<C, Boolean> function) implements Property<C> {

        public BooleanValue {
            Objects.requireNonNull(function, "function must not be null");
        }

        @Override
        public ValueKind kind() {
            return ValueKind.BOOLEAN;
        }
    }

    record IntegerValue<C>(TemplateProperty<C, Long> function) implements Property<C> {

        public IntegerValue {
            Objects.requireNonNull(function, "function must not be null");
        }

        @Override
        public ValueKind kind() {
            return ValueKind.INTEGER;
        }
    }

    record CommitOrChangeIdValue<C>(TemplateProperty<C, CommitOrChangeId> function) implements Property<C> {

        public CommitOrChangeIdValue {
            Objects.requireNonNull(function, "function must not be null");
        }

        @Override
        public ValueKind kind() {
            return ValueKind.COMMIT_OR_CHANGE_ID;
        }
    }

    record ShortestIdPrefixValue<C>(TemplateProperty<C, ShortestIdPrefix> function) implements Property<C> {

        public ShortestIdPrefixValue {
            Objects.requireNonNull(function, "function must not be null");
        }

        @Override
        public ValueKind kind() {
            return ValueKind.SHORTEST_ID_PREFIX;
        }
    }

    record SignatureValue<C>(TemplateProperty<C, Signature> function) implements Property<C> {

        public SignatureValue {
            Objects.requireNonNull(function, "function must not be null");
        }

        @Override
        public ValueKind kind() {
            return ValueKind.SIGNATURE;
        }
    }

    record TimestampValue<C>(TemplateProperty<C, Timestamp> function) implements Property<C> {

        public TimestampValue {
            Objects.requireNonNull(function, "function must not be null");
        }

        @Override
        public ValueKind kind() {
            return ValueKind.TIMESTAMP;
        }
    }
}
