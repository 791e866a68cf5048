package io.templatekit.core.syntax;

/** Outcome of matching one grammar rule at the current position. */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /** Matched; the context now sits just past {@code node}. */
    record Success(CstNode node) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /** Not matched; the context has been restored to where the attempt began. */
    record Failure(SourceLocation location, String expected) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    static ParseResult success(CstNode node) {
        return new Success(node);
    }

    static ParseResult failure(SourceLocation location, String expected) {
        return new Failure(location, expected);
    }
}
