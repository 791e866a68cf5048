package io.templatekit.core.model;

import java.util.Collection;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * {@link IdPrefixIndex} over a fixed set of ids. The shortest unique prefix of an id is one digit
 * longer than the longest prefix it shares with its sorted neighbours.
 *
 * <p>Immutable and thread-safe.
 */
public final class HexPrefixIndex implements IdPrefixIndex {

    private final NavigableSet<String> ids;

    private HexPrefixIndex(Collection<String> ids) {
        this.ids = new TreeSet<>(ids);
    }

    public static HexPrefixIndex of(Collection<String> ids) {
        return new HexPrefixIndex(ids);
    }

    @Override
    public int shortestUniquePrefixLength(String hex) {
        int shared = 0;
        String lower = ids.lower(hex);
        if (lower != null) {
            shared = Math.max(shared, commonPrefixLength(lower, hex));
        }
        String higher = ids.higher(hex);
        if (higher != null) {
            shared = Math.max(shared, commonPrefixLength(higher, hex));
        }
        return Math.min(shared + 1, hex.length());
    }

    public int size() {
        return ids.size();
    }

    private static int commonPrefixLength(String a, String b) {
        int limit = Math.min(a.length(), b.length());
        int i = 0;
        while (i < limit && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return i;
    }
}
