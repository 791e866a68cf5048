package io.templatekit.core.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Concrete syntax tree node. Produced by {@link TemplateSyntaxParser} and consumed entirely by
 * {@code AstBuilder}; nothing retains it after the abstract syntax tree is built.
 */
public sealed interface CstNode {

    /** The source span covered by this node, excluding surrounding whitespace. */
    SourceSpan span();

    /** The grammar rule that produced this node. */
    TemplateRule rule();

    /** Leaf node that matched source text directly. */
    record Terminal(SourceSpan span, TemplateRule rule, String text) implements CstNode {

        public Terminal {
            Objects.requireNonNull(span, "span must not be null");
            Objects.requireNonNull(rule, "rule must not be null");
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /** Interior node; children appear in source order. */
    record NonTerminal(SourceSpan span, TemplateRule rule, List<CstNode> children) implements CstNode {

        public NonTerminal {
            Objects.requireNonNull(span, "span must not be null");
            Objects.requireNonNull(rule, "rule must not be null");
            children = List.copyOf(children);
        }
    }
}
