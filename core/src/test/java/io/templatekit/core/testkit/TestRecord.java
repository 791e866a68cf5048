package io.templatekit.core.testkit;

import io.templatekit.core.model.Signature;
import io.templatekit.core.model.Timestamp;

/** Context record used by compiler and engine tests. */
public record TestRecord(String description, String commitId, Signature author, long count, boolean flag) {

    public static final String COMMIT_ID = "abcdef0123456789abcdef0123456789abcdef01";

    /** 2023-11-14T22:13:20Z, recorded at +01:00. */
    public static final Timestamp AUTHORED = new Timestamp(1_700_000_000_000L, 60);

    public static TestRecord sample() {
        return new TestRecord(
                "fix parser\n\nlonger body\n",
                COMMIT_ID,
                new Signature("Alice Example", "alice@example.com", AUTHORED),
                42,
                true);
    }

    public TestRecord withDescription(String text) {
        return new TestRecord(text, commitId, author, count, flag);
    }

    public TestRecord withFlag(boolean value) {
        return new TestRecord(description, commitId, author, count, value);
    }

    public TestRecord withCount(long value) {
        return new TestRecord(description, commitId, author, value, flag);
    }
}
