package io.templatekit.core.build;

import io.templatekit.core.ast.FunctionCallNode;
import io.templatekit.core.model.CommitOrChangeId;
import io.templatekit.core.model.ShortestIdPrefix;
import io.templatekit.core.model.Signature;
import io.templatekit.core.model.Timestamp;
import io.templatekit.core.property.Property;
import io.templatekit.core.property.TemplateProperty;
import io.templatekit.core.property.ValueKind;
import java.util.Optional;

/**
 * The method tables of the seven value kinds, and dispatch from a receiver property to the table
 * of its kind. Boolean and Integer have no methods.
 */
public final class ValueMethods<C> {

    private final MethodTable<C, String> stringMethods = stringMethods();
    private final MethodTable<C, Boolean> booleanMethods = MethodTable.<C, Boolean>builder(ValueKind.BOOLEAN).build();
    private final MethodTable<C, Long> integerMethods = MethodTable.<C, Long>builder(ValueKind.INTEGER).build();
    private final MethodTable<C, CommitOrChangeId> commitOrChangeIdMethods = commitOrChangeIdMethods();
    private final MethodTable<C, ShortestIdPrefix> shortestIdPrefixMethods = shortestIdPrefixMethods();
    private final MethodTable<C, Signature> signatureMethods = signatureMethods();
    private final MethodTable<C, Timestamp> timestampMethods = timestampMethods();

    /** Builds {@code function} against {@code receiver} using the table for the receiver's kind. */
    public Property<C> build(Property<C> receiver, FunctionCallNode function, ExpressionBuilder<C> builder) {
        switch (receiver.kind()) {
            case STRING:
                return stringMethods.build(((Property.StringValue<C>) receiver).function(), function, builder);
            case BOOLEAN:
                return booleanMethods.build(((Property.BooleanValue<C>) receiver).function(), function, builder);
            case INTEGER:
                return integerMethods.build(((Property.IntegerValue<C>) receiver).function(), function, builder);
            case COMMIT_OR_CHANGE_ID:
                return commitOrChangeIdMethods.build(
                        ((Property.CommitOrChangeIdValue<C>) receiver).function(), function, builder);
            case SHORTEST_ID_PREFIX:
                return shortestIdPrefixMethods.build(
                        ((Property.ShortestIdPrefixValue<C>) receiver).function(), function, builder);
            case SIGNATURE:
                return signatureMethods.build(((Property.SignatureValue<C>) receiver).function(), function, builder);
            case TIMESTAMP:
                return timestampMethods.build(((Property.TimestampValue<C>) receiver).function(), function, builder);
            default:
                throw new IllegalStateException("Unhandled value kind: " + receiver.kind());
        }
    }

    private static <C> MethodTable<C, String> stringMethods() {
        return MethodTable.<C, String>builder(ValueKind.STRING)
                .method("contains", (self, function, builder) -> {
                    var needleNode = Arguments.expectExactArguments(function, 1).get(0);
                    TemplateProperty<C, String> needle = builder.build(needleNode).intoPlainText();
                    return Property.bool(TemplateProperty.combine(self, needle, String::contains));
                })
                .method("first_line", (self, function, builder) -> {
                    Arguments.expectNoArguments(function);
                    return Property.string(self.map(ValueMethods::firstLine));
                })
                .build();
    }

    private static <C> MethodTable<C, CommitOrChangeId> commitOrChangeIdMethods() {
        return MethodTable.<C, CommitOrChangeId>builder(ValueKind.COMMIT_OR_CHANGE_ID)
                .method("short", (self, function, builder) -> {
                    var length = optionalInteger(function, builder);
                    return Property.string(TemplateProperty.combine(
                            self,
                            lengthOrDefault(length, CommitOrChangeId.DEFAULT_SHORT_LENGTH),
                            CommitOrChangeId::shortHex));
                })
                .method("shortest", (self, function, builder) -> {
                    var length = optionalInteger(function, builder);
                    return Property.shortestIdPrefix(
                            TemplateProperty.combine(self, lengthOrDefault(length, 0), CommitOrChangeId::shortest));
                })
                .build();
    }

    private static <C> MethodTable<C, ShortestIdPrefix> shortestIdPrefixMethods() {
        return MethodTable.<C, ShortestIdPrefix>builder(ValueKind.SHORTEST_ID_PREFIX)
                .method("with_brackets", (self, function, builder) -> {
                    Arguments.expectNoArguments(function);
                    return Property.string(self.map(ShortestIdPrefix::withBrackets));
                })
                .build();
    }

    private static <C> MethodTable<C, Signature> signatureMethods() {
        return MethodTable.<C, Signature>builder(ValueKind.SIGNATURE)
                .method("name", (self, function, builder) -> {
                    Arguments.expectNoArguments(function);
                    return Property.string(self.map(Signature::name));
                })
                .method("email", (self, function, builder) -> {
                    Arguments.expectNoArguments(function);
                    return Property.string(self.map(Signature::email));
                })
                .method("username", (self, function, builder) -> {
                    Arguments.expectNoArguments(function);
                    return Property.string(self.map(Signature::username));
                })
                .method("timestamp", (self, function, builder) -> {
                    Arguments.expectNoArguments(function);
                    return Property.timestamp(self.map(Signature::timestamp));
                })
                .build();
    }

    private static <C> MethodTable<C, Timestamp> timestampMethods() {
        return MethodTable.<C, Timestamp>builder(ValueKind.TIMESTAMP)
                .method("ago", (self, function, builder) -> {
                    Arguments.expectNoArguments(function);
                    var clock = builder.clock();
                    return Property.string(self.map(timestamp -> timestamp.formatRelativeTo(clock.instant())));
                })
                .build();
    }

    /** Builds the single optional Integer argument of {@code short()} and {@code shortest()}. */
    private static <C> Optional<TemplateProperty<C, Long>> optionalInteger(
            FunctionCallNode function, ExpressionBuilder<C> builder) {
        var args = Arguments.expectArguments(function, 0, 1);
        return args.optional(0).map(node -> builder.build(node)
                .tryIntoInteger()
                .orElseThrow(() -> BuildErrors.invalidArgumentType(ValueKind.INTEGER.typeName(), node.span())));
    }

    /** Negative lengths fall back to the default; lengths beyond {@code int} range are clamped. */
    private static <C> TemplateProperty<C, Integer> lengthOrDefault(
            Optional<TemplateProperty<C, Long>> length, int defaultLength) {
        if (length.isEmpty()) {
            return TemplateProperty.constant(defaultLength);
        }
        return length.get().map(value -> value < 0 ? defaultLength : (int) Math.min(value, Integer.MAX_VALUE));
    }

    static String firstLine(String text) {
        int newline = text.indexOf('\n');
        String line = newline < 0 ? text : text.substring(0, newline);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
