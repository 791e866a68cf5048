package io.templatekit.core.ast;

import java.util.Objects;

/** {@code receiver.function(args...)}. */
public record MethodCallNode(ExpressionNode receiver, FunctionCallNode function) {

    public MethodCallNode {
        Objects.requireNonNull(receiver, "receiver must not be null");
        Objects.requireNonNull(function, "function must not be null");
    }
}
