package io.templatekit.core.template;

import io.templatekit.core.spi.Formatter;

/**
 * A node of the evaluation tree. Immutable once built; {@link #format} may be called any number
 * of times, including concurrently for different contexts.
 *
 * @param <C> context type
 */
@FunctionalInterface
public interface Template<C> {

    void format(C context, Formatter formatter);
}
