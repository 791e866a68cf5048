package io.templatekit.commit;

import io.templatekit.core.model.HexPrefixIndex;
import io.templatekit.core.model.IdPrefixIndex;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * {@link RepoView} over commits and refs held in memory. Built once with {@link #builder()} and
 * immutable afterwards.
 *
 * <p>The merged tree of several parents with different trees is modelled as a synthetic id
 * derived from the parent trees; a commit is empty only if it records exactly that id.
 */
public final class InMemoryRepoView implements RepoView {

    /** Tree id of the root commit's (non-existent) parent. */
    public static final String EMPTY_TREE_ID = "0000000000000000000000000000000000000000";

    private final Map<String, Commit> commits;
    private final SortedMap<String, String> workingCopies;
    private final SortedMap<String, BranchTarget> branches;
    private final SortedMap<String, RefTarget> tags;
    private final SortedMap<String, RefTarget> gitRefs;
    private final RefTarget gitHead;
    private final Map<String, List<String>> commitsByChangeId;
    private final IdPrefixIndex commitIdIndex;
    private final IdPrefixIndex changeIdIndex;

    private InMemoryRepoView(Builder builder) {
        this.commits = Collections.unmodifiableMap(new LinkedHashMap<>(builder.commits));
        this.workingCopies = Collections.unmodifiableSortedMap(new TreeMap<>(builder.workingCopies));
        this.branches = Collections.unmodifiableSortedMap(new TreeMap<>(builder.branches));
        this.tags = Collections.unmodifiableSortedMap(new TreeMap<>(builder.tags));
        this.gitRefs = Collections.unmodifiableSortedMap(new TreeMap<>(builder.gitRefs));
        this.gitHead = builder.gitHead;
        this.commitsByChangeId = commits.values().stream()
                .collect(Collectors.groupingBy(
                        Commit::changeId, Collectors.mapping(Commit::commitId, Collectors.toUnmodifiableList())));
        this.commitIdIndex = HexPrefixIndex.of(commits.keySet());
        this.changeIdIndex = HexPrefixIndex.of(commitsByChangeId.keySet());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Commit> commit(String commitId) {
        return Optional.ofNullable(commits.get(commitId));
    }

    @Override
    public SortedMap<String, String> workingCopyCommitIds() {
        return workingCopies;
    }

    @Override
    public SortedMap<String, BranchTarget> branches() {
        return branches;
    }

    @Override
    public SortedMap<String, RefTarget> tags() {
        return tags;
    }

    @Override
    public SortedMap<String, RefTarget> gitRefs() {
        return gitRefs;
    }

    @Override
    public Optional<RefTarget> gitHead() {
        return Optional.ofNullable(gitHead);
    }

    @Override
    public List<String> resolveChangeId(String changeId) {
        return commitsByChangeId.getOrDefault(changeId, List.of());
    }

    @Override
    public IdPrefixIndex commitIdIndex() {
        return commitIdIndex;
    }

    @Override
    public IdPrefixIndex changeIdIndex() {
        return changeIdIndex;
    }

    @Override
    public String mergedParentTreeId(Commit commit) {
        List<String> parentTrees = new ArrayList<>();
        for (String parentId : commit.parentIds()) {
            Commit parent = commits.get(parentId);
            if (parent == null) {
                throw new IllegalStateException("Parent " + parentId + " of " + commit.commitId() + " is not in the view");
            }
            if (!parentTrees.contains(parent.treeId())) {
                parentTrees.add(parent.treeId());
            }
        }
        if (parentTrees.isEmpty()) {
            return EMPTY_TREE_ID;
        }
        if (parentTrees.size() == 1) {
            return parentTrees.get(0);
        }
        return "merge(" + parentTrees.stream().sorted().collect(Collectors.joining(",")) + ")";
    }

    /** Builder for {@link InMemoryRepoView}. */
    public static final class Builder {

        private final Map<String, Commit> commits = new LinkedHashMap<>();
        private final Map<String, String> workingCopies = new TreeMap<>();
        private final Map<String, BranchTarget> branches = new TreeMap<>();
        private final Map<String, RefTarget> tags = new TreeMap<>();
        private final Map<String, RefTarget> gitRefs = new TreeMap<>();
        private RefTarget gitHead;

        Builder() {}

        public Builder addCommit(Commit commit) {
            Objects.requireNonNull(commit, "commit must not be null");
            commits.put(commit.commitId(), commit);
            return this;
        }

        public Builder workingCopy(String workspace, String commitId) {
            workingCopies.put(workspace, commitId);
            return this;
        }

        public Builder branch(String name, BranchTarget target) {
            branches.put(name, target);
            return this;
        }

        /** Sets the local target of {@code name}, keeping any remote targets already recorded. */
        public Builder localBranch(String name, RefTarget target) {
            var existing = branches.get(name);
            branches.put(name, new BranchTarget(target, existing == null ? Map.of() : existing.remoteTargets()));
            return this;
        }

        public Builder remoteBranch(String name, String remote, RefTarget target) {
            var existing = branches.getOrDefault(name, new BranchTarget(null, Map.of()));
            branches.put(name, existing.withRemote(remote, target));
            return this;
        }

        public Builder tag(String name, RefTarget target) {
            tags.put(name, target);
            return this;
        }

        public Builder gitRef(String name, RefTarget target) {
            gitRefs.put(name, target);
            return this;
        }

        public Builder gitHead(RefTarget target) {
            this.gitHead = target;
            return this;
        }

        public InMemoryRepoView build() {
            return new InMemoryRepoView(this);
        }
    }
}
