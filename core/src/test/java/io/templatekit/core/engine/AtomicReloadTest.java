package io.templatekit.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.templatekit.core.config.SettingsParser;
import io.templatekit.core.config.TemplateSettings;
import io.templatekit.core.testkit.TestKeywords;
import io.templatekit.core.testkit.TestRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

/**
 * Renders in flight while the registry is swapped must always see one complete template set,
 * never a mix or a missing template.
 */
class AtomicReloadTest {

    private static final int READERS = 4;

    @Test
    void readersSeeEitherTheOldOrTheNewRegistry() throws Exception {
        SettingsParser parser = new SettingsParser();
        TemplateSettings first = parser.parse("templates:\n  main: '\"v1:\" count'\n", "first");
        TemplateSettings second = parser.parse("templates:\n  main: '\"v2:\" count'\n", "second");
        TemplateEngine<TestRecord> engine = new TemplateEngine<>(new TestKeywords());
        engine.reload(first);

        Set<String> seen = ConcurrentHashMap.newKeySet();
        AtomicBoolean running = new AtomicBoolean(true);
        CountDownLatch started = new CountDownLatch(READERS);
        ExecutorService executor = Executors.newFixedThreadPool(READERS);
        try {
            List<Future<?>> readers = new ArrayList<>();
            for (int i = 0; i < READERS; i++) {
                readers.add(executor.submit(() -> {
                    started.countDown();
                    while (running.get()) {
                        seen.add(engine.render("main", TestRecord.sample()).plainText());
                    }
                    return null;
                }));
            }
            started.await(10, TimeUnit.SECONDS);
            for (int i = 0; i < 200; i++) {
                engine.reload(i % 2 == 0 ? second : first);
            }
            running.set(false);
            for (Future<?> reader : readers) {
                reader.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(seen).isNotEmpty().isSubsetOf("v1:42", "v2:42");
    }
}
