package io.templatekit.core.property;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A pure computation of a value of type {@code O} from a context record {@code C}. Invoked once per
 * render; implementations must not keep per-call state, so one instance may serve concurrent
 * renders.
 *
 * @param <C> context (record) type
 * @param <O> output type
 */
@FunctionalInterface
public interface TemplateProperty<C, O> {

    O extract(C context);

    /** Applies {@code function} to every extracted value. */
    default <P> TemplateProperty<C, P> map(Function<? super O, ? extends P> function) {
        Objects.requireNonNull(function, "function must not be null");
        return context -> function.apply(extract(context));
    }

    static <C, O> TemplateProperty<C, O> constant(O value) {
        return context -> value;
    }

    /** Extracts both properties from the same context and combines the results. */
    static <C, A, B, O> TemplateProperty<C, O> combine(
            TemplateProperty<C, A> first,
            TemplateProperty<C, B> second,
            BiFunction<? super A, ? super B, ? extends O> combiner) {
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
        Objects.requireNonNull(combiner, "combiner must not be null");
        return context -> combiner.apply(first.extract(context), second.extract(context));
    }
}
