package io.templatekit.commit;

import static io.templatekit.commit.RepoFixture.C1;
import static io.templatekit.commit.RepoFixture.C2;
import static io.templatekit.commit.RepoFixture.C3;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryRepoViewTest {

    private final InMemoryRepoView repo = RepoFixture.repo();

    @Test
    void mergedParentTree() {
        assertThat(repo.mergedParentTreeId(RepoFixture.ROOT_COMMIT)).isEqualTo(InMemoryRepoView.EMPTY_TREE_ID);
        assertThat(repo.mergedParentTreeId(RepoFixture.COMMIT_1)).isEqualTo("tree-root");
        assertThat(repo.mergedParentTreeId(RepoFixture.COMMIT_2)).isEqualTo("tree-1");

        var sameTrees = RepoFixture.commit("55", "ee", "", List.of(C1, C2), "x", false);
        var differentTrees = RepoFixture.commit("66", "ff", "", List.of(C3, C2), "x", false);
        assertThat(repo.mergedParentTreeId(sameTrees)).isEqualTo("tree-1");
        assertThat(repo.mergedParentTreeId(differentTrees)).isEqualTo("merge(tree-1,tree-3)");
    }

    @Test
    void unknownParentIsAnError() {
        var orphan = RepoFixture.commit("77", "ff", "", List.of("99"), "x", false);

        assertThatThrownBy(() -> repo.mergedParentTreeId(orphan))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("99");
    }

    @Test
    void changeIdResolvesToEveryRewrite() {
        assertThat(repo.resolveChangeId(RepoFixture.DIVERGENT_CHANGE)).containsExactlyInAnyOrder(C2, C3);
        assertThat(repo.resolveChangeId(RepoFixture.C1_CHANGE)).containsExactly(C1);
        assertThat(repo.resolveChangeId("ffff")).isEmpty();
    }

    @Test
    void lookups() {
        assertThat(repo.commit(C1)).contains(RepoFixture.COMMIT_1);
        assertThat(repo.commit("nope")).isEmpty();
        assertThat(repo.workingCopyCommitId("default")).contains(C2);
        assertThat(repo.workingCopyCommitId("missing")).isEmpty();
        assertThat(repo.workingCopyCommitIds().keySet()).containsExactly("default", "other");
        assertThat(repo.branches().keySet()).containsExactly("conflicted", "feature", "main", "remote-only");
        assertThat(repo.gitHead()).contains(RefTarget.normal(C2));
    }

    @Test
    void remoteTargetsSurviveLaterLocalUpdate() {
        var view = RepoFixture.commits()
                .remoteBranch("b", "origin", RefTarget.normal(C1))
                .localBranch("b", RefTarget.normal(C2))
                .build();

        BranchTarget target = view.branches().get("b");
        assertThat(target.local()).contains(RefTarget.normal(C2));
        assertThat(target.remoteTargets()).containsEntry("origin", RefTarget.normal(C1));
    }

    @Test
    void refTargetConflicts() {
        assertThat(RefTarget.normal(C1).isConflict()).isFalse();
        assertThat(RefTarget.conflict(List.of(C1), List.of(C2)).isConflict()).isTrue();
        assertThat(RefTarget.conflict(List.of(), List.of(C2, C3)).isConflict()).isTrue();
        assertThat(RefTarget.conflict(List.of(C1), List.of(C2, C3)).hasAdd(C1)).isFalse();
        assertThatThrownBy(() -> RefTarget.conflict(List.of(C1), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void branchTargetIsImmutable() {
        BranchTarget local = BranchTarget.local(RefTarget.normal(C1));
        BranchTarget withRemote = local.withRemote("origin", RefTarget.normal(C2));

        assertThat(local.remoteTargets()).isEmpty();
        assertThat(withRemote.remoteTargets()).containsOnlyKeys("origin");
        assertThat(new BranchTarget(null, Map.of()).local()).isEmpty();
    }
}
