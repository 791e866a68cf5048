package io.templatekit.core.ast;

import io.templatekit.core.syntax.SourceSpan;
import java.util.Objects;

/**
 * Abstract syntax tree node. Names are resolved and types checked later, by the expression
 * builder; at this stage the tree only records what was written and where.
 */
public record ExpressionNode(ExpressionKind kind, SourceSpan span) {

    public ExpressionNode {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }
}
