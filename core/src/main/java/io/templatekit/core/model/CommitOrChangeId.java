package io.templatekit.core.model;

import java.util.Objects;

/**
 * A commit or change id in hex form, paired with the index that knows which prefixes of it are
 * ambiguous. Displays as the full hex string.
 */
public final class CommitOrChangeId {

    public static final int DEFAULT_SHORT_LENGTH = 12;

    private final String hex;
    private final IdPrefixIndex index;

    public CommitOrChangeId(String hex, IdPrefixIndex index) {
        this.hex = Objects.requireNonNull(hex, "hex must not be null");
        this.index = Objects.requireNonNull(index, "index must not be null");
    }

    public String hex() {
        return hex;
    }

    /** The first {@code length} hex digits, or the whole id if it is shorter. */
    public String shortHex(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative: " + length);
        }
        return hex.substring(0, Math.min(length, hex.length()));
    }

    /**
     * The shortest unambiguous prefix, padded with following digits to at least {@code
     * totalLength} characters.
     */
    public ShortestIdPrefix shortest(int totalLength) {
        if (totalLength < 0) {
            throw new IllegalArgumentException("totalLength must not be negative: " + totalLength);
        }
        int prefixLength = Math.min(index.shortestUniquePrefixLength(hex), hex.length());
        String shown = hex.substring(0, Math.min(Math.max(prefixLength, totalLength), hex.length()));
        return new ShortestIdPrefix(shown.substring(0, prefixLength), shown.substring(prefixLength));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CommitOrChangeId other && hex.equals(other.hex);
    }

    @Override
    public int hashCode() {
        return hex.hashCode();
    }

    @Override
    public String toString() {
        return hex;
    }
}
