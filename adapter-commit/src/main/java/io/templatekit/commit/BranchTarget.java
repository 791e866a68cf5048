package io.templatekit.commit;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A branch's local target, if it exists locally, and its targets on each remote.
 *
 * @param localTarget local target, or {@code null} if the branch only exists on remotes
 * @param remoteTargets targets by remote name
 */
public record BranchTarget(RefTarget localTarget, Map<String, RefTarget> remoteTargets) {

    public BranchTarget {
        remoteTargets = Collections.unmodifiableMap(new TreeMap<>(remoteTargets));
    }

    public static BranchTarget local(RefTarget target) {
        return new BranchTarget(target, Map.of());
    }

    public Optional<RefTarget> local() {
        return Optional.ofNullable(localTarget);
    }

    /** Returns a copy with {@code target} recorded for {@code remote}. */
    public BranchTarget withRemote(String remote, RefTarget target) {
        var remotes = new TreeMap<>(remoteTargets);
        remotes.put(remote, target);
        return new BranchTarget(localTarget, remotes);
    }
}
