package io.templatekit.core.engine;

import io.templatekit.core.template.ColorRules;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of the named templates and color rules loaded from one settings document.
 *
 * <p>This is the unit of atomic swap in {@link TemplateEngine#reload}. Renders that captured the
 * old snapshot finish with it; later lookups see the new one.
 */
public final class TemplateRegistry<C> {

    private final Map<String, CompiledTemplate<C>> templates;
    private final ColorRules colorRules;

    /**
     * Creates a registry. The map is copied; later changes by the caller are not seen.
     *
     * @param templates compiled templates by name, in declaration order
     * @param colorRules color rules for colored rendering
     */
    public TemplateRegistry(Map<String, CompiledTemplate<C>> templates, ColorRules colorRules) {
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
        this.colorRules = Objects.requireNonNull(colorRules, "colorRules must not be null");
    }

    public static <C> TemplateRegistry<C> empty() {
        return new TemplateRegistry<>(Map.of(), ColorRules.empty());
    }

    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    public Optional<CompiledTemplate<C>> template(String name) {
        return Optional.ofNullable(templates.get(name));
    }

    /** Unmodifiable view of all templates, in declaration order. */
    public Map<String, CompiledTemplate<C>> allTemplates() {
        return templates;
    }

    public int templateCount() {
        return templates.size();
    }

    public ColorRules colorRules() {
        return colorRules;
    }

    /** Builder for constructing a {@link TemplateRegistry} incrementally. */
    public static final class Builder<C> {

        private final Map<String, CompiledTemplate<C>> templates = new LinkedHashMap<>();
        private ColorRules colorRules = ColorRules.empty();

        Builder() {}

        public Builder<C> addTemplate(String name, CompiledTemplate<C> template) {
            templates.put(name, template);
            return this;
        }

        public Builder<C> colorRules(ColorRules rules) {
            this.colorRules = rules;
            return this;
        }

        public TemplateRegistry<C> build() {
            return new TemplateRegistry<>(templates, colorRules);
        }
    }
}
