package io.templatekit.commit;

import io.templatekit.core.model.IdPrefixIndex;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Read-only view of a repository at one operation. Everything the commit keywords need beyond the
 * commit itself comes from here.
 *
 * <p>Implementations MUST be immutable or otherwise safe for concurrent reads.
 */
public interface RepoView {

    /** Working-copy commit id of each workspace, by workspace name. */
    SortedMap<String, String> workingCopyCommitIds();

    default Optional<String> workingCopyCommitId(String workspace) {
        return Optional.ofNullable(workingCopyCommitIds().get(workspace));
    }

    SortedMap<String, BranchTarget> branches();

    SortedMap<String, RefTarget> tags();

    SortedMap<String, RefTarget> gitRefs();

    Optional<RefTarget> gitHead();

    /** Visible commit ids carrying {@code changeId}; empty if the change is unknown or hidden. */
    List<String> resolveChangeId(String changeId);

    IdPrefixIndex commitIdIndex();

    IdPrefixIndex changeIdIndex();

    /** Tree id obtained by merging the trees of {@code commit}'s parents. */
    String mergedParentTreeId(Commit commit);
}
