package io.templatekit.core.property;

/** The closed set of value kinds a template property can produce. */
public enum ValueKind {
    STRING("String"),
    BOOLEAN("Boolean"),
    INTEGER("Integer"),
    COMMIT_OR_CHANGE_ID("CommitOrChangeId"),
    SHORTEST_ID_PREFIX("ShortestIdPrefix"),
    SIGNATURE("Signature"),
    TIMESTAMP("Timestamp");

    private final String typeName;

    ValueKind(String typeName) {
        this.typeName = typeName;
    }

    /** Type name used in error messages, e.g. {@code "CommitOrChangeId"}. */
    public String typeName() {
        return typeName;
    }
}
