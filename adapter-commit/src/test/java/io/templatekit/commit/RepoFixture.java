package io.templatekit.commit;

import io.templatekit.core.model.Signature;
import io.templatekit.core.model.Timestamp;
import java.util.List;

/**
 * A small repository shared by the adapter tests:
 *
 * <pre>
 *   C2 (default@)   C3 (other@)
 *          \        /
 *             C1
 *             |
 *            ROOT
 * </pre>
 *
 * C2 and C3 are rewrites of the same change, so both are divergent. C2 keeps C1's tree and is
 * therefore empty; C3 has conflicts.
 */
final class RepoFixture {

    static final String ROOT = "1111111111111111111111111111111111111111";
    static final String C1 = "2222222222222222222222222222222222222222";
    static final String C2 = "2233333333333333333333333333333333333333";
    static final String C3 = "3333333333333333333333333333333333333333";

    static final String ROOT_CHANGE = "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";
    static final String C1_CHANGE = "bbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb";
    static final String DIVERGENT_CHANGE = "bc000000000000000000000000000000";

    /** 2023-11-14T22:13:20Z. */
    static final Timestamp WHEN = new Timestamp(1_700_000_000_000L, 0);

    static final Signature AUTHOR = new Signature("Test User", "test.user@example.com", WHEN);

    static final Commit ROOT_COMMIT = commit(ROOT, ROOT_CHANGE, "", List.of(), "tree-root", false);
    static final Commit COMMIT_1 = commit(C1, C1_CHANGE, "first", List.of(ROOT), "tree-1", false);
    static final Commit COMMIT_2 = commit(C2, DIVERGENT_CHANGE, "", List.of(C1), "tree-1", false);
    static final Commit COMMIT_3 =
            commit(C3, DIVERGENT_CHANGE, "third\nwith body\n", List.of(C1), "tree-3", true);

    private RepoFixture() {}

    static Commit commit(
            String id, String changeId, String description, List<String> parents, String tree, boolean conflict) {
        return new Commit(id, changeId, description, AUTHOR, AUTHOR, parents, tree, conflict);
    }

    static InMemoryRepoView.Builder commits() {
        return InMemoryRepoView.builder()
                .addCommit(ROOT_COMMIT)
                .addCommit(COMMIT_1)
                .addCommit(COMMIT_2)
                .addCommit(COMMIT_3);
    }

    static InMemoryRepoView repo() {
        return commits()
                .workingCopy("default", C2)
                .workingCopy("other", C3)
                .localBranch("main", RefTarget.normal(C1))
                .remoteBranch("main", "origin", RefTarget.normal(C1))
                .localBranch("feature", RefTarget.normal(C2))
                .remoteBranch("feature", "origin", RefTarget.normal(C1))
                .localBranch("conflicted", RefTarget.conflict(List.of(C1), List.of(C2, C3)))
                .remoteBranch("remote-only", "origin", RefTarget.normal(C3))
                .tag("v1", RefTarget.normal(C1))
                .tag("weird", RefTarget.conflict(List.of(), List.of(C1, C2)))
                .gitRef("refs/heads/main", RefTarget.normal(C1))
                .gitHead(RefTarget.normal(C2))
                .build();
    }
}
