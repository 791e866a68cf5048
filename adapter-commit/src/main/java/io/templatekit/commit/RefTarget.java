package io.templatekit.commit;

import java.util.List;

/**
 * Where a ref points. A normal ref has one added commit and nothing removed; anything else is a
 * conflict left by concurrent updates.
 */
public record RefTarget(List<String> removes, List<String> adds) {

    public RefTarget {
        removes = List.copyOf(removes);
        adds = List.copyOf(adds);
        if (adds.isEmpty()) {
            throw new IllegalArgumentException("A ref target must add at least one commit");
        }
    }

    public static RefTarget normal(String commitId) {
        return new RefTarget(List.of(), List.of(commitId));
    }

    public static RefTarget conflict(List<String> removes, List<String> adds) {
        return new RefTarget(removes, adds);
    }

    public boolean isConflict() {
        return !removes.isEmpty() || adds.size() > 1;
    }

    public boolean hasAdd(String commitId) {
        return adds.contains(commitId);
    }
}
