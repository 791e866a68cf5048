package io.templatekit.core.build;

import io.templatekit.core.ast.FunctionCallNode;
import io.templatekit.core.property.Property;
import io.templatekit.core.property.TemplateProperty;

/**
 * Builds one method of a value kind: checks the call's arguments and returns the resulting
 * property.
 *
 * @param <C> context type
 * @param <T> receiver value type
 */
@FunctionalInterface
public interface MethodBuilder<C, T> {

    Property<C> build(TemplateProperty<C, T> self, FunctionCallNode function, ExpressionBuilder<C> builder);
}
