package io.templatekit.core.build;

import io.templatekit.core.ast.ExpressionKind;
import io.templatekit.core.ast.ExpressionNode;
import io.templatekit.core.ast.MethodCallNode;
import io.templatekit.core.property.Property;
import io.templatekit.core.property.PropertyAndLabels;
import io.templatekit.core.property.TemplateProperty;
import io.templatekit.core.spi.KeywordResolver;
import io.templatekit.core.template.ListTemplate;
import io.templatekit.core.template.LiteralTemplate;
import io.templatekit.core.template.Template;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The semantic pass: turns AST nodes into typed {@link Expression}s. Identifiers go to the
 * {@link KeywordResolver}, global functions to the {@link FunctionTable} and methods to the
 * receiver kind's {@link MethodTable}. The first error aborts the build.
 *
 * <p>Holds no mutable state, so one builder may serve concurrent compilations if its resolver
 * allows it.
 *
 * @param <C> context type
 */
public final class ExpressionBuilder<C> {

    private final KeywordResolver<C> resolver;
    private final FunctionTable<C> functions;
    private final ValueMethods<C> methods;
    private final Clock clock;

    public ExpressionBuilder(KeywordResolver<C> resolver, Clock clock) {
        this(resolver, FunctionTable.standard(), clock);
    }

    public ExpressionBuilder(KeywordResolver<C> resolver, FunctionTable<C> functions, Clock clock) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.functions = Objects.requireNonNull(functions, "functions must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.methods = new ValueMethods<>();
    }

    /** Clock used by time-relative methods such as {@code ago()}; read at render time. */
    public Clock clock() {
        return clock;
    }

    /**
     * Builds {@code node}.
     *
     * @throws io.templatekit.core.error.TemplateParseException on the first name, arity or type
     *     error
     */
    public Expression<C> build(ExpressionNode node) {
        ExpressionKind kind = node.kind();
        if (kind instanceof ExpressionKind.Identifier identifier) {
            PropertyAndLabels<C> property = resolver.resolve(identifier.name(), node.span())
                    .orElseThrow(() -> BuildErrors.noSuchKeyword(identifier.name(), node.span()));
            return new Expression.PropertyExpression<>(property);
        }
        if (kind instanceof ExpressionKind.IntegerLiteral integer) {
            Property<C> property = Property.integer(TemplateProperty.constant(integer.value()));
            return new Expression.PropertyExpression<>(PropertyAndLabels.unlabeled(property));
        }
        if (kind instanceof ExpressionKind.StringLiteral string) {
            Property<C> property = Property.string(new LiteralTemplate<C>(string.value()));
            return new Expression.PropertyExpression<>(PropertyAndLabels.unlabeled(property));
        }
        if (kind instanceof ExpressionKind.TemplateList list) {
            List<Template<C>> templates = new ArrayList<>(list.nodes().size());
            for (ExpressionNode child : list.nodes()) {
                templates.add(build(child).intoTemplate());
            }
            return new Expression.TemplateExpression<>(new ListTemplate<>(templates));
        }
        if (kind instanceof ExpressionKind.FunctionCall call) {
            return functions.build(call.function(), this);
        }
        if (kind instanceof ExpressionKind.MethodCall call) {
            return buildMethodCall(call.method());
        }
        throw new IllegalStateException("Unhandled expression kind: " + kind);
    }

    private Expression<C> buildMethodCall(MethodCallNode method) {
        Expression<C> receiver = build(method.receiver());
        if (receiver instanceof Expression.PropertyExpression<C> property) {
            PropertyAndLabels<C> labeled = property.property();
            Property<C> result = methods.build(labeled.property(), method.function(), this);
            return new Expression.PropertyExpression<>(
                    labeled.withProperty(result).withLabel(method.function().name()));
        }
        throw BuildErrors.noSuchMethod("Template", method.function());
    }
}
