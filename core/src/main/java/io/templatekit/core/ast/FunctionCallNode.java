package io.templatekit.core.ast;

import io.templatekit.core.syntax.SourceSpan;
import java.util.List;
import java.util.Objects;

/**
 * A call {@code name(args...)}, either a global function or the call part of a method call.
 *
 * @param name function or method name
 * @param nameSpan span of the name alone, used for unknown-name errors
 * @param args arguments in source order
 * @param argsSpan span of the argument list between the parentheses, used for arity errors
 */
public record FunctionCallNode(String name, SourceSpan nameSpan, List<ExpressionNode> args, SourceSpan argsSpan) {

    public FunctionCallNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(nameSpan, "nameSpan must not be null");
        Objects.requireNonNull(argsSpan, "argsSpan must not be null");
        args = List.copyOf(args);
    }
}
