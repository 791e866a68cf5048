package io.templatekit.core.engine;

import io.templatekit.core.build.ExpressionBuilder;
import io.templatekit.core.build.FunctionTable;
import io.templatekit.core.build.TemplateCompiler;
import io.templatekit.core.config.SettingsParser;
import io.templatekit.core.config.TemplateSettings;
import io.templatekit.core.error.TemplateParseException;
import io.templatekit.core.spi.KeywordResolver;
import io.templatekit.core.template.RenderedText;
import io.templatekit.core.template.Template;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles templates for one context type and keeps a registry of named templates loaded from
 * settings.
 *
 * <p>Thread-safe: the registry is an immutable {@link TemplateRegistry} snapshot held in an
 * {@link AtomicReference}. {@link #reload} compiles the complete new set first and swaps it in
 * only if every template compiled, so a bad settings file never replaces a good registry.
 *
 * @param <C> context type
 */
public final class TemplateEngine<C> {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateEngine.class);

    private final ExpressionBuilder<C> builder;
    private final SettingsParser settingsParser;
    private final AtomicReference<TemplateRegistry<C>> registryRef = new AtomicReference<>(TemplateRegistry.empty());

    /**
     * Creates an engine with the standard functions and the system clock.
     *
     * @param resolver resolves keywords of the context type
     */
    public TemplateEngine(KeywordResolver<C> resolver) {
        this(resolver, Clock.systemDefaultZone());
    }

    public TemplateEngine(KeywordResolver<C> resolver, Clock clock) {
        this(resolver, FunctionTable.standard(), clock, new SettingsParser());
    }

    /**
     * Creates an engine with all configuration options.
     *
     * @param resolver resolves keywords of the context type
     * @param functions global functions available to templates
     * @param clock clock read by {@code ago()} at render time
     * @param settingsParser parser used by {@link #load(Path)}
     */
    public TemplateEngine(
            KeywordResolver<C> resolver, FunctionTable<C> functions, Clock clock, SettingsParser settingsParser) {
        this.builder = new ExpressionBuilder<>(resolver, functions, clock);
        this.settingsParser = Objects.requireNonNull(settingsParser, "settingsParser must not be null");
    }

    /**
     * Compiles an anonymous template.
     *
     * @throws TemplateParseException on the first syntax, name, arity or type error
     */
    public CompiledTemplate<C> compile(String source) {
        return compile(null, source);
    }

    private CompiledTemplate<C> compile(String name, String source) {
        Objects.requireNonNull(source, "source must not be null");
        long start = System.nanoTime();
        Template<C> tree = TemplateCompiler.compile(source, builder);
        long durationUs = (System.nanoTime() - start) / 1_000;
        LOG.debug("template.compiled source_length={} duration_us={}", source.length(), durationUs);
        return new CompiledTemplate<>(name, source, tree);
    }

    /**
     * Atomically replaces the registry with the templates and colors in {@code settings}.
     *
     * @throws TemplateParseException attributed to the first template that fails; the previous
     *     registry stays active
     */
    public void reload(TemplateSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        TemplateRegistry.Builder<C> registryBuilder = TemplateRegistry.builder();
        registryBuilder.colorRules(settings.colors());
        for (Map.Entry<String, String> entry : settings.templates().entrySet()) {
            String name = entry.getKey();
            try {
                registryBuilder.addTemplate(name, compile(name, entry.getValue()));
            } catch (TemplateParseException e) {
                LOG.warn("template.rejected name={} error={}", name, e.getMessage());
                throw e.withSource(name);
            }
        }

        // Atomic swap; renders in flight keep the old reference
        TemplateRegistry<C> newRegistry = registryBuilder.build();
        registryRef.set(newRegistry);
        LOG.info("Registry reloaded: templates={}", newRegistry.templateCount());
    }

    /**
     * Parses the settings file at {@code path} and reloads from it.
     *
     * @throws io.templatekit.core.error.SettingsLoadException if the file cannot be read or is
     *     invalid
     * @throws TemplateParseException if a template in it fails to compile
     */
    public void load(Path path) {
        reload(settingsParser.parse(path));
    }

    /** Returns the current registry snapshot. */
    public TemplateRegistry<C> registry() {
        return registryRef.get();
    }

    public Optional<CompiledTemplate<C>> template(String name) {
        return registryRef.get().template(name);
    }

    /** @throws IllegalArgumentException if no template has that name */
    public CompiledTemplate<C> requireTemplate(String name) {
        return template(name).orElseThrow(() -> new IllegalArgumentException("Unknown template: '" + name + "'"));
    }

    /** Renders the named template with label metadata. */
    public RenderedText render(String name, C context) {
        return requireTemplate(name).render(context);
    }

    /** Renders the named template with the registry's color rules. */
    public String renderColored(String name, C context) {
        TemplateRegistry<C> snapshot = registryRef.get();
        CompiledTemplate<C> template = snapshot.template(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown template: '" + name + "'"));
        return template.renderColored(context, snapshot.colorRules());
    }
}
