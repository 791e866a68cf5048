package io.templatekit.core.spi;

import io.templatekit.core.property.PropertyAndLabels;
import io.templatekit.core.syntax.SourceSpan;
import java.util.Optional;

/**
 * Resolves identifiers in a template to properties of the context type. This is the only place
 * where a concrete record type enters the compiler.
 *
 * <p>Implementations MUST be stateless and thread-safe: a resolver may be shared by concurrent
 * compilations, and the properties it returns are invoked by concurrent renders.
 *
 * @param <C> context (record) type
 */
@FunctionalInterface
public interface KeywordResolver<C> {

    /**
     * Resolves a keyword.
     *
     * @param name identifier as written in the template
     * @param span where the identifier appears, for resolvers that raise their own errors
     * @return the property and its labels, or empty if the keyword does not exist
     */
    Optional<PropertyAndLabels<C>> resolve(String name, SourceSpan span);
}
