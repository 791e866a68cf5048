package io.templatekit.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.templatekit.core.error.SettingsLoadException;
import io.templatekit.core.template.AnsiColor;
import io.templatekit.core.template.ColorRules;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses YAML settings documents into {@link TemplateSettings}:
 *
 * <pre>
 * templates:
 *   oneline: 'commit_id.short() " " description.first_line()'
 * colors:
 *   commit_id: blue
 *   "working_copy commit_id": bright green
 * </pre>
 *
 * <p>Unknown top-level keys are rejected so that typos are caught at load time. Unknown color
 * names are skipped with a warning. Templates are not compiled here.
 *
 * <p>Thread-safe.
 */
public final class SettingsParser {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsParser.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Recognized top-level settings keys. */
    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("templates", "colors");

    /**
     * Parses the YAML file at {@code path}.
     *
     * @throws SettingsLoadException if the file cannot be read or is structurally invalid
     */
    public TemplateSettings parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new SettingsLoadException("Failed to read or parse YAML: " + e.getMessage(), e, source);
        }
        return parse(root, source);
    }

    /**
     * Parses YAML text.
     *
     * @param yaml settings document
     * @param source identifier used in error messages
     * @throws SettingsLoadException if the document is structurally invalid
     */
    public TemplateSettings parse(String yaml, String source) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new SettingsLoadException("Failed to parse YAML: " + e.getMessage(), e, source);
        }
        return parse(root, source);
    }

    private TemplateSettings parse(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            LOG.debug("Settings loaded: source={}, templates=0, colors=0 (empty document)", source);
            return TemplateSettings.empty();
        }
        if (!root.isObject()) {
            throw new SettingsLoadException("Settings document must be a mapping", source);
        }
        rejectUnknownKeys(root, source);

        Map<String, String> templates = parseTemplates(root.get("templates"), source);
        ColorRules colors = parseColors(root.get("colors"), source);
        LOG.debug(
                "Settings loaded: source={}, templates={}, colors={}",
                source,
                templates.size(),
                colors.rules().size());
        return new TemplateSettings(templates, colors);
    }

    private Map<String, String> parseTemplates(JsonNode node, String source) {
        Map<String, String> templates = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> field : requireMapping(node, "templates", source).entrySet()) {
            JsonNode value = field.getValue();
            if (!value.isTextual()) {
                throw new SettingsLoadException(
                        "Template '" + field.getKey() + "' must be a string, got " + value.getNodeType(), source);
            }
            templates.put(field.getKey(), value.asText());
        }
        return templates;
    }

    private ColorRules parseColors(JsonNode node, String source) {
        ColorRules.Builder rules = ColorRules.builder();
        for (Map.Entry<String, JsonNode> field : requireMapping(node, "colors", source).entrySet()) {
            String labels = field.getKey();
            JsonNode value = field.getValue();
            if (!value.isTextual()) {
                throw new SettingsLoadException(
                        "Color for '" + labels + "' must be a string, got " + value.getNodeType(), source);
            }
            if (labels.isBlank()) {
                throw new SettingsLoadException("Color rule must name at least one label", source);
            }
            Optional<AnsiColor> color = AnsiColor.parse(value.asText());
            if (color.isPresent()) {
                rules.rule(labels, color.get());
            } else {
                LOG.warn("Unknown color ignored: source={}, labels='{}', color='{}'", source, labels, value.asText());
            }
        }
        return rules.build();
    }

    private Map<String, JsonNode> requireMapping(JsonNode node, String blockName, String source) {
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return fields;
        }
        if (!node.isObject()) {
            throw new SettingsLoadException("'" + blockName + "' must be a mapping", source);
        }
        node.fields().forEachRemaining(field -> fields.put(field.getKey(), field.getValue()));
        return fields;
    }

    private void rejectUnknownKeys(JsonNode node, String source) {
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !KNOWN_ROOT_KEYS.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new SettingsLoadException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in settings: " + unknown
                            + " (recognized keys are: " + KNOWN_ROOT_KEYS.stream().sorted().collect(Collectors.toList())
                            + ")",
                    source);
        }
    }
}
