package io.templatekit.core.model;

/** Answers how many leading hex digits make an id unambiguous among the ids a repository knows. */
@FunctionalInterface
public interface IdPrefixIndex {

    /** An index where every id is unique after its first digit. */
    IdPrefixIndex TRIVIAL = hex -> Math.min(1, hex.length());

    /**
     * Returns the length of the shortest prefix of {@code hex} that no other known id shares.
     *
     * @param hex lowercase hex id
     * @return a length between 0 and {@code hex.length()}
     */
    int shortestUniquePrefixLength(String hex);
}
