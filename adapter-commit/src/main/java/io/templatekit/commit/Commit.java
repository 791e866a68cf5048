package io.templatekit.commit;

import io.templatekit.core.model.Signature;
import java.util.List;
import java.util.Objects;

/**
 * A commit as seen by templates.
 *
 * @param commitId hex commit id
 * @param changeId hex change id, shared by all rewrites of the same change
 * @param description commit message, possibly empty
 * @param author author signature
 * @param committer committer signature
 * @param parentIds hex ids of the parent commits
 * @param treeId id of the commit's tree
 * @param hasConflict whether the tree contains unresolved conflicts
 */
public record Commit(
        String commitId,
        String changeId,
        String description,
        Signature author,
        Signature committer,
        List<String> parentIds,
        String treeId,
        boolean hasConflict) {

    public Commit {
        Objects.requireNonNull(commitId, "commitId must not be null");
        Objects.requireNonNull(changeId, "changeId must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(author, "author must not be null");
        Objects.requireNonNull(committer, "committer must not be null");
        parentIds = List.copyOf(parentIds);
        Objects.requireNonNull(treeId, "treeId must not be null");
    }
}
