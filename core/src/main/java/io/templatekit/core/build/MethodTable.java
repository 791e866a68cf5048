package io.templatekit.core.build;

import io.templatekit.core.ast.FunctionCallNode;
import io.templatekit.core.property.Property;
import io.templatekit.core.property.TemplateProperty;
import io.templatekit.core.property.ValueKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Methods available on one value kind, by name. Immutable. */
public final class MethodTable<C, T> {

    private final ValueKind kind;
    private final Map<String, MethodBuilder<C, T>> methods;

    private MethodTable(ValueKind kind, Map<String, MethodBuilder<C, T>> methods) {
        this.kind = kind;
        this.methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }

    public static <C, T> Builder<C, T> builder(ValueKind kind) {
        return new Builder<>(kind);
    }

    public ValueKind kind() {
        return kind;
    }

    /**
     * Builds {@code function} against {@code self}.
     *
     * @throws io.templatekit.core.error.TemplateParseException {@code NoSuchMethod} if this kind
     *     has no such method, or whatever the method's own argument checks raise
     */
    public Property<C> build(TemplateProperty<C, T> self, FunctionCallNode function, ExpressionBuilder<C> builder) {
        MethodBuilder<C, T> method = methods.get(function.name());
        if (method == null) {
            throw BuildErrors.noSuchMethod(kind.typeName(), function);
        }
        return method.build(self, function, builder);
    }

    public static final class Builder<C, T> {

        private final ValueKind kind;
        private final Map<String, MethodBuilder<C, T>> methods = new LinkedHashMap<>();

        Builder(ValueKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
        }

        public Builder<C, T> method(String name, MethodBuilder<C, T> method) {
            methods.put(Objects.requireNonNull(name, "name must not be null"), method);
            return this;
        }

        public MethodTable<C, T> build() {
            return new MethodTable<>(kind, methods);
        }
    }
}
