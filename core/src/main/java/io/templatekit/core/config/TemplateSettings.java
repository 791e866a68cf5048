package io.templatekit.core.config;

import io.templatekit.core.template.ColorRules;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named templates and color rules read from a settings document.
 *
 * @param templates template source by name, in declaration order
 * @param colors color rules for colored rendering
 */
public record TemplateSettings(Map<String, String> templates, ColorRules colors) {

    private static final TemplateSettings EMPTY = new TemplateSettings(Map.of(), ColorRules.empty());

    public TemplateSettings {
        templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
        Objects.requireNonNull(colors, "colors must not be null");
    }

    public static TemplateSettings empty() {
        return EMPTY;
    }
}
