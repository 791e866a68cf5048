package io.templatekit.core.build;

import io.templatekit.core.ast.FunctionCallNode;

/**
 * Builds a call to a global function. Implementations check their own arguments and build them
 * through {@code builder}.
 */
@FunctionalInterface
public interface BuiltinFunction<C> {

    Expression<C> build(FunctionCallNode function, ExpressionBuilder<C> builder);
}
