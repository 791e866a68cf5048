package io.templatekit.core.error;

import java.util.Objects;

/**
 * What went wrong while compiling a template. Each kind renders its own message; the location is
 * carried separately by {@link TemplateParseException}.
 */
public sealed interface TemplateParseErrorKind {

    /** Human-readable description without location. */
    String message();

    /** The source text does not match the grammar. */
    record SyntaxError(String detail) implements TemplateParseErrorKind {

        public SyntaxError {
            Objects.requireNonNull(detail, "detail must not be null");
        }

        @Override
        public String message() {
            return "Syntax error: " + detail;
        }
    }

    /** An integer literal does not fit in a signed 64-bit value. */
    record ParseIntError(String literal) implements TemplateParseErrorKind {

        @Override
        public String message() {
            return "Invalid integer literal: " + literal;
        }
    }

    record NoSuchKeyword(String name) implements TemplateParseErrorKind {

        @Override
        public String message() {
            return "Keyword \"" + name + "\" doesn't exist";
        }
    }

    record NoSuchFunction(String name) implements TemplateParseErrorKind {

        @Override
        public String message() {
            return "Function \"" + name + "\" doesn't exist";
        }
    }

    record NoSuchMethod(String typeName, String name) implements TemplateParseErrorKind {

        @Override
        public String message() {
            return "Method \"" + name + "\" doesn't exist for type \"" + typeName + "\"";
        }
    }

    record InvalidArgumentCountExact(int count) implements TemplateParseErrorKind {

        @Override
        public String message() {
            return "Expected " + count + " arguments";
        }
    }

    /** Argument count outside the inclusive range {@code [min, max]}. */
    record InvalidArgumentCountRange(int min, int max) implements TemplateParseErrorKind {

        public InvalidArgumentCountRange {
            if (max < min) {
                throw new IllegalArgumentException("max " + max + " < min " + min);
            }
        }

        @Override
        public String message() {
            return "Expected " + min + " to " + max + " arguments";
        }
    }

    record InvalidArgumentCountRangeFrom(int min) implements TemplateParseErrorKind {

        @Override
        public String message() {
            return "Expected at least " + min + " arguments";
        }
    }

    record InvalidArgumentType(String expectedType) implements TemplateParseErrorKind {

        @Override
        public String message() {
            return "Expected argument of type \"" + expectedType + "\"";
        }
    }
}
