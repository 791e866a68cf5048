package io.templatekit.core.build;

import io.templatekit.core.ast.FunctionCallNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Global functions by name. The language is extended by registering entries, never by
 * subclassing. Immutable; use {@link #toBuilder()} to derive an extended table.
 */
public final class FunctionTable<C> {

    private final Map<String, BuiltinFunction<C>> functions;

    private FunctionTable(Map<String, BuiltinFunction<C>> functions) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    /** {@code label}, {@code if} and {@code separate}. */
    public static <C> FunctionTable<C> standard() {
        return FunctionTable.<C>builder()
                .function("label", BuiltinFunctions::label)
                .function("if", BuiltinFunctions::conditional)
                .function("separate", BuiltinFunctions::separate)
                .build();
    }

    public static <C> Builder<C> builder() {
        return new Builder<>(Map.of());
    }

    public Builder<C> toBuilder() {
        return new Builder<>(functions);
    }

    public Set<String> functionNames() {
        return functions.keySet();
    }

    public Optional<BuiltinFunction<C>> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    /**
     * Builds a global function call.
     *
     * @throws io.templatekit.core.error.TemplateParseException {@code NoSuchFunction} for unknown
     *     names, or whatever the function's argument checks raise
     */
    public Expression<C> build(FunctionCallNode function, ExpressionBuilder<C> builder) {
        return function(function.name())
                .orElseThrow(() -> BuildErrors.noSuchFunction(function))
                .build(function, builder);
    }

    public static final class Builder<C> {

        private final Map<String, BuiltinFunction<C>> functions;

        Builder(Map<String, BuiltinFunction<C>> initial) {
            this.functions = new LinkedHashMap<>(initial);
        }

        /** Registers {@code function} under {@code name}, replacing any existing entry. */
        public Builder<C> function(String name, BuiltinFunction<C> function) {
            functions.put(
                    Objects.requireNonNull(name, "name must not be null"),
                    Objects.requireNonNull(function, "function must not be null"));
            return this;
        }

        public FunctionTable<C> build() {
            return new FunctionTable<>(functions);
        }
    }
}
