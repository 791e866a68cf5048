package io.templatekit.core.build;

import io.templatekit.core.ast.ExpressionNode;
import io.templatekit.core.ast.FunctionCallNode;
import io.templatekit.core.property.TemplateProperty;
import io.templatekit.core.property.ValueKind;
import io.templatekit.core.template.ConditionalTemplate;
import io.templatekit.core.template.LabelTemplate;
import io.templatekit.core.template.SeparateTemplate;
import io.templatekit.core.template.Template;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** The standard global functions. */
final class BuiltinFunctions {

    private BuiltinFunctions() {}

    /** {@code label(labels, content)}: labels are whitespace-separated and evaluated per render. */
    static <C> Expression<C> label(FunctionCallNode function, ExpressionBuilder<C> builder) {
        var args = Arguments.expectExactArguments(function, 2);
        TemplateProperty<C, String> labelText = builder.build(args.get(0)).intoPlainText();
        Template<C> content = builder.build(args.get(1)).intoTemplate();
        return new Expression.TemplateExpression<>(new LabelTemplate<>(content, labelText.map(BuiltinFunctions::splitLabels)));
    }

    /** {@code if(condition, then[, else])}. */
    static <C> Expression<C> conditional(FunctionCallNode function, ExpressionBuilder<C> builder) {
        var args = Arguments.expectArguments(function, 2, 1);
        ExpressionNode conditionNode = args.required().get(0);
        TemplateProperty<C, Boolean> condition = builder.build(conditionNode)
                .tryIntoBoolean()
                .orElseThrow(() -> BuildErrors.invalidArgumentType(ValueKind.BOOLEAN.typeName(), conditionNode.span()));
        Template<C> trueTemplate = builder.build(args.required().get(1)).intoTemplate();
        Template<C> falseTemplate = args.optional(0)
                .map(node -> builder.build(node).intoTemplate())
                .orElse(null);
        return new Expression.TemplateExpression<>(new ConditionalTemplate<>(condition, trueTemplate, falseTemplate));
    }

    /** {@code separate(separator, contents...)}. */
    static <C> Expression<C> separate(FunctionCallNode function, ExpressionBuilder<C> builder) {
        var args = Arguments.expectSomeArguments(function, 1);
        Template<C> separator = builder.build(args.required().get(0)).intoTemplate();
        List<Template<C>> contents = new ArrayList<>(args.rest().size());
        for (ExpressionNode node : args.rest()) {
            contents.add(builder.build(node).intoTemplate());
        }
        return new Expression.TemplateExpression<>(new SeparateTemplate<>(separator, contents));
    }

    static List<String> splitLabels(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return List.copyOf(Arrays.asList(trimmed.split("\\s+")));
    }
}
