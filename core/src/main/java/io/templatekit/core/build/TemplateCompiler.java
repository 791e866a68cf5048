package io.templatekit.core.build;

import io.templatekit.core.ast.AstBuilder;
import io.templatekit.core.ast.ExpressionNode;
import io.templatekit.core.spi.KeywordResolver;
import io.templatekit.core.template.Template;
import java.time.Clock;

/** Entry points for turning template text into an evaluation tree. */
public final class TemplateCompiler {

    private TemplateCompiler() {}

    /**
     * Parses template text without resolving names.
     *
     * @throws io.templatekit.core.error.TemplateParseException on syntax errors
     */
    public static ExpressionNode parse(String source) {
        return AstBuilder.parse(source);
    }

    /** Compiles against the system clock. */
    public static <C> Template<C> compile(String source, KeywordResolver<C> resolver) {
        return compile(source, resolver, Clock.systemDefaultZone());
    }

    /**
     * Parses and builds {@code source}. The returned tree is immutable and may be rendered
     * repeatedly and concurrently.
     *
     * @param source template text
     * @param resolver resolves identifiers to properties of {@code C}
     * @param clock clock read by {@code ago()} at render time
     * @throws io.templatekit.core.error.TemplateParseException on the first error found
     */
    public static <C> Template<C> compile(String source, KeywordResolver<C> resolver, Clock clock) {
        return compile(source, new ExpressionBuilder<>(resolver, clock));
    }

    public static <C> Template<C> compile(String source, ExpressionBuilder<C> builder) {
        return builder.build(parse(source)).intoTemplate();
    }
}
