package io.templatekit.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.templatekit.core.config.SettingsParser;
import io.templatekit.core.config.TemplateSettings;
import io.templatekit.core.error.TemplateParseErrorKind;
import io.templatekit.core.error.TemplateParseException;
import io.templatekit.core.template.RenderedText;
import io.templatekit.core.testkit.TestKeywords;
import io.templatekit.core.testkit.TestRecord;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TemplateEngineTest {

    private static final Clock CLOCK = Clock.fixed(TestRecord.AUTHORED.instant().plusSeconds(7200), ZoneOffset.UTC);

    private final SettingsParser settingsParser = new SettingsParser();
    private TemplateEngine<TestRecord> engine;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        engine = new TemplateEngine<>(new TestKeywords(), CLOCK);
    }

    private TemplateSettings settings(String yaml) {
        return settingsParser.parse(yaml, "test");
    }

    @Test
    void compileProducesAnonymousHandle() {
        CompiledTemplate<TestRecord> template = engine.compile("count \" \" author.timestamp().ago()");

        assertThat(template.name()).isEmpty();
        assertThat(template.source()).isEqualTo("count \" \" author.timestamp().ago()");
        assertThat(template.renderPlain(TestRecord.sample())).isEqualTo("42 2 hours ago");
        assertThat(template).hasToString("CompiledTemplate[count \" \" author.timestamp().ago()]");
    }

    @Test
    void compileErrorsPropagateUnattributed() {
        assertThatThrownBy(() -> engine.compile("nope"))
                .isInstanceOf(TemplateParseException.class)
                .extracting(e -> ((TemplateParseException) e).source())
                .isNull();
    }

    @Test
    void renderReturnsLabelledSegments() {
        RenderedText text = engine.compile("\"id \" commit_id.short(4)").render(TestRecord.sample());

        assertThat(text.segments())
                .containsExactly(
                        new RenderedText.Segment("id ", List.of()),
                        new RenderedText.Segment("abcd", List.of("commit_id", "short")));
    }

    @Test
    void reloadInstallsNamedTemplatesAndColors() {
        engine.reload(settings("""
                templates:
                  oneline: 'commit_id.short(4) " " count'
                  flagged: 'if(flag, "yes", "no")'
                colors:
                  commit_id: blue
                """));

        assertThat(engine.registry().templateCount()).isEqualTo(2);
        assertThat(engine.registry().allTemplates().keySet()).containsExactly("oneline", "flagged");
        assertThat(engine.requireTemplate("oneline").name()).contains("oneline");
        assertThat(engine.render("flagged", TestRecord.sample()).plainText()).isEqualTo("yes");
        assertThat(engine.renderColored("oneline", TestRecord.sample()))
                .isEqualTo("\u001b[34mabcd\u001b[0m 42");
    }

    @Test
    void failedReloadKeepsPreviousRegistry() {
        engine.reload(settings("templates:\n  good: 'count'\n"));
        TemplateRegistry<TestRecord> before = engine.registry();

        assertThatThrownBy(() -> engine.reload(settings("templates:\n  good: 'flag'\n  broken: 'nope'\n")))
                .isInstanceOf(TemplateParseException.class)
                .satisfies(e -> {
                    var ex = (TemplateParseException) e;
                    assertThat(ex.source()).isEqualTo("broken");
                    assertThat(ex.kind()).isEqualTo(new TemplateParseErrorKind.NoSuchKeyword("nope"));
                });

        assertThat(engine.registry()).isSameAs(before);
        assertThat(engine.requireTemplate("good").renderPlain(TestRecord.sample())).isEqualTo("42");
    }

    @Test
    void unknownTemplateNameIsRejected() {
        assertThatThrownBy(() -> engine.requireTemplate("nope"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown template: 'nope'");
        assertThatThrownBy(() -> engine.renderColored("nope", TestRecord.sample()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(engine.template("nope")).isEmpty();
    }

    @Test
    void loadReadsSettingsFile() throws Exception {
        Path file = tempDir.resolve("templates.yaml");
        Files.writeString(file, """
                templates:
                  who: 'author.name() " <" author.email() ">"'
                """);

        engine.load(file);

        assertThat(engine.render("who", TestRecord.sample()).plainText())
                .isEqualTo("Alice Example <alice@example.com>");
    }

    @Test
    void reloadWithEmptySettingsClearsRegistry() {
        engine.reload(settings("templates:\n  a: 'count'\n"));

        engine.reload(TemplateSettings.empty());

        assertThat(engine.registry().templateCount()).isZero();
        assertThat(engine.registry().colorRules().rules()).isEmpty();
    }
}
