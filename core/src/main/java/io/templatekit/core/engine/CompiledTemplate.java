package io.templatekit.core.engine;

import io.templatekit.core.spi.Formatter;
import io.templatekit.core.template.ColorFormatter;
import io.templatekit.core.template.ColorRules;
import io.templatekit.core.template.LabeledTextFormatter;
import io.templatekit.core.template.PlainTextFormatter;
import io.templatekit.core.template.RenderedText;
import io.templatekit.core.template.Template;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable, thread-safe compiled template handle. Produced by {@link TemplateEngine#compile}
 * and shared freely; every render method creates its own formatter.
 */
public final class CompiledTemplate<C> implements Template<C> {

    private final String name;
    private final String source;
    private final Template<C> tree;

    CompiledTemplate(String name, String source, Template<C> tree) {
        this.name = name;
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
    }

    /** Registry name, empty for templates compiled directly. */
    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public String source() {
        return source;
    }

    /** Streams the rendering of {@code context} into {@code formatter}. */
    @Override
    public void format(C context, Formatter formatter) {
        tree.format(context, formatter);
    }

    /** Renders text with its label metadata. */
    public RenderedText render(C context) {
        var formatter = new LabeledTextFormatter();
        tree.format(context, formatter);
        return formatter.result();
    }

    public String renderPlain(C context) {
        var formatter = new PlainTextFormatter();
        tree.format(context, formatter);
        return formatter.text();
    }

    /** Renders with ANSI colors selected by {@code rules}. */
    public String renderColored(C context, ColorRules rules) {
        var formatter = new ColorFormatter(rules);
        tree.format(context, formatter);
        return formatter.text();
    }

    @Override
    public String toString() {
        return "CompiledTemplate[" + (name != null ? name + ": " : "") + source + "]";
    }
}
