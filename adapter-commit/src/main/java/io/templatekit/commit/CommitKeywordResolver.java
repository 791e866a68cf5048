package io.templatekit.commit;

import io.templatekit.core.model.CommitOrChangeId;
import io.templatekit.core.property.Property;
import io.templatekit.core.property.PropertyAndLabels;
import io.templatekit.core.spi.KeywordResolver;
import io.templatekit.core.syntax.SourceSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Commit keywords for templates rendered against {@link Commit}s. Each keyword is labelled with
 * its own name.
 *
 * <p>Thread-safe if the {@link RepoView} is.
 */
public final class CommitKeywordResolver implements KeywordResolver<Commit> {

    /** All keywords this resolver knows. */
    public static final Set<String> KEYWORDS = Set.of(
            "description",
            "change_id",
            "commit_id",
            "author",
            "committer",
            "working_copies",
            "current_working_copy",
            "branches",
            "tags",
            "git_refs",
            "git_head",
            "divergent",
            "conflict",
            "empty");

    private final RepoView repo;
    private final String workspace;

    /**
     * @param repo repository the rendered commits belong to
     * @param workspace workspace whose working copy {@code current_working_copy} refers to
     */
    public CommitKeywordResolver(RepoView repo, String workspace) {
        this.repo = Objects.requireNonNull(repo, "repo must not be null");
        this.workspace = Objects.requireNonNull(workspace, "workspace must not be null");
    }

    @Override
    public Optional<PropertyAndLabels<Commit>> resolve(String name, SourceSpan span) {
        Property<Commit> property = property(name);
        return property == null ? Optional.empty() : Optional.of(PropertyAndLabels.labeled(property, name));
    }

    private Property<Commit> property(String name) {
        switch (name) {
            case "description":
                return Property.string(commit -> completeNewline(commit.description()));
            case "change_id":
                return Property.commitOrChangeId(
                        commit -> new CommitOrChangeId(commit.changeId(), repo.changeIdIndex()));
            case "commit_id":
                return Property.commitOrChangeId(
                        commit -> new CommitOrChangeId(commit.commitId(), repo.commitIdIndex()));
            case "author":
                return Property.signature(Commit::author);
            case "committer":
                return Property.signature(Commit::committer);
            case "working_copies":
                return Property.string(this::workingCopies);
            case "current_working_copy":
                return Property.bool(commit -> repo.workingCopyCommitId(workspace)
                        .map(commit.commitId()::equals)
                        .orElse(false));
            case "branches":
                return Property.string(this::branches);
            case "tags":
                return Property.string(commit -> refNames(repo.tags(), commit));
            case "git_refs":
                return Property.string(commit -> refNames(repo.gitRefs(), commit));
            case "git_head":
                return Property.string(this::gitHead);
            case "divergent":
                return Property.bool(commit -> repo.resolveChangeId(commit.changeId()).size() > 1);
            case "conflict":
                return Property.bool(Commit::hasConflict);
            case "empty":
                return Property.bool(commit -> commit.treeId().equals(repo.mergedParentTreeId(commit)));
            default:
                return null;
        }
    }

    /** Appends a newline to non-empty text that does not already end with one. */
    static String completeNewline(String text) {
        return text.isEmpty() || text.endsWith("\n") ? text : text + "\n";
    }

    private String workingCopies(Commit commit) {
        Map<String, String> workingCopies = repo.workingCopyCommitIds();
        if (workingCopies.size() <= 1) {
            return "";
        }
        List<String> names = new ArrayList<>();
        workingCopies.forEach((name, commitId) -> {
            if (commitId.equals(commit.commitId())) {
                names.add(name + "@");
            }
        });
        return String.join(" ", names);
    }

    private String branches(Commit commit) {
        List<String> names = new ArrayList<>();
        repo.branches().forEach((name, target) -> {
            RefTarget local = target.localTarget();
            if (local != null && local.hasAdd(commit.commitId())) {
                if (local.isConflict()) {
                    names.add(name + "?");
                } else if (target.remoteTargets().values().stream().anyMatch(remote -> !remote.equals(local))) {
                    names.add(name + "*");
                } else {
                    names.add(name);
                }
            }
            target.remoteTargets().forEach((remoteName, remote) -> {
                if (!remote.equals(local) && remote.hasAdd(commit.commitId())) {
                    names.add(name + "@" + remoteName + (remote.isConflict() ? "?" : ""));
                }
            });
        });
        return String.join(" ", names);
    }

    private static String refNames(Map<String, RefTarget> refs, Commit commit) {
        List<String> names = new ArrayList<>();
        refs.forEach((name, target) -> {
            if (target.hasAdd(commit.commitId())) {
                names.add(target.isConflict() ? name + "?" : name);
            }
        });
        return String.join(" ", names);
    }

    private String gitHead(Commit commit) {
        return repo.gitHead()
                .filter(head -> head.equals(RefTarget.normal(commit.commitId())))
                .map(head -> "HEAD@git")
                .orElse("");
    }
}
