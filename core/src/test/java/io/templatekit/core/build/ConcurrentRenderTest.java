package io.templatekit.core.build;

import static org.assertj.core.api.Assertions.assertThat;

import io.templatekit.core.template.PlainTextFormatter;
import io.templatekit.core.template.Template;
import io.templatekit.core.testkit.TestKeywords;
import io.templatekit.core.testkit.TestRecord;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

/** One compiled tree shared by many threads, each rendering its own records. */
class ConcurrentRenderTest {

    private static final int THREADS = 8;
    private static final int RENDERS_PER_THREAD = 500;

    @Test
    void sharedTreeRendersIndependentlyPerThread() throws Exception {
        Template<TestRecord> template = TemplateCompiler.compile(
                "separate(\" \", count, if(flag, \"even\", \"odd\"), description.first_line())",
                new TestKeywords(),
                Clock.systemUTC());

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                int thread = t;
                Callable<Integer> task = () -> {
                    int mismatches = 0;
                    for (int i = 0; i < RENDERS_PER_THREAD; i++) {
                        long n = thread * 1_000L + i;
                        TestRecord record = TestRecord.sample()
                                .withCount(n)
                                .withFlag(n % 2 == 0)
                                .withDescription("line " + n + "\nrest");
                        var formatter = new PlainTextFormatter();
                        template.format(record, formatter);
                        String expected = n + " " + (n % 2 == 0 ? "even" : "odd") + " line " + n;
                        if (!formatter.text().equals(expected)) {
                            mismatches++;
                        }
                    }
                    return mismatches;
                };
                futures.add(executor.submit(task));
            }
            for (Future<Integer> future : futures) {
                assertThat(future.get(30, TimeUnit.SECONDS)).isZero();
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
