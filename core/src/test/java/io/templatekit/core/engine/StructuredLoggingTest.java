package io.templatekit.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.templatekit.core.config.SettingsParser;
import io.templatekit.core.error.TemplateParseException;
import io.templatekit.core.testkit.TestKeywords;
import io.templatekit.core.testkit.TestRecord;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Log entries emitted by {@link TemplateEngine} on compile and reload. */
class StructuredLoggingTest {

    private final SettingsParser parser = new SettingsParser();
    private TemplateEngine<TestRecord> engine;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger engineLogger;

    @BeforeEach
    void setUp() {
        engine = new TemplateEngine<>(new TestKeywords());

        // Attach a log capture appender to TemplateEngine's logger
        engineLogger = (Logger) LoggerFactory.getLogger(TemplateEngine.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        engineLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        engineLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    void compileLogsSourceLengthAndDuration() {
        engine.compile("count");

        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.DEBUG)
                .extracting(ILoggingEvent::getFormattedMessage)
                .singleElement(InstanceOfAssertFactories.STRING)
                .matches("template\\.compiled source_length=5 duration_us=\\d+");
    }

    @Test
    void successfulReloadLogsTemplateCount() {
        engine.reload(parser.parse("templates:\n  a: 'count'\n  b: 'flag'\n", "test"));

        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.INFO)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Registry reloaded: templates=2");
    }

    @Test
    @DisplayName("Rejected template → WARN naming the template, no reload entry")
    void rejectedTemplateLogsWarning() {
        assertThatThrownBy(() -> engine.reload(parser.parse("templates:\n  broken: 'nope'\n", "test")))
                .isInstanceOf(TemplateParseException.class);

        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("template.rejected name=broken error=line 1, column 1: Keyword \"nope\" doesn't exist");
        assertThat(logAppender.list).noneMatch(event -> event.getLevel() == Level.INFO);
    }
}
