package io.templatekit.core.ast;

import java.util.List;
import java.util.Objects;

/** The shape of an {@link ExpressionNode}. */
public sealed interface ExpressionKind {

    record Identifier(String name) implements ExpressionKind {

        public Identifier {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record IntegerLiteral(long value) implements ExpressionKind {}

    /** A string literal with escapes already decoded. */
    record StringLiteral(String value) implements ExpressionKind {

        public StringLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** Juxtaposed terms, rendered one after another. */
    record TemplateList(List<ExpressionNode> nodes) implements ExpressionKind {

        public TemplateList {
            nodes = List.copyOf(nodes);
        }
    }

    record FunctionCall(FunctionCallNode function) implements ExpressionKind {

        public FunctionCall {
            Objects.requireNonNull(function, "function must not be null");
        }
    }

    record MethodCall(MethodCallNode method) implements ExpressionKind {

        public MethodCall {
            Objects.requireNonNull(method, "method must not be null");
        }
    }
}
