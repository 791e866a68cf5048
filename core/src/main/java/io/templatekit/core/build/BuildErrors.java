package io.templatekit.core.build;

import io.templatekit.core.ast.FunctionCallNode;
import io.templatekit.core.error.TemplateParseErrorKind;
import io.templatekit.core.error.TemplateParseException;
import io.templatekit.core.syntax.SourceSpan;

/** Factories for the semantic-pass errors, each placed at the span the error is reported on. */
final class BuildErrors {

    private BuildErrors() {}

    static TemplateParseException noSuchKeyword(String name, SourceSpan span) {
        return new TemplateParseException(new TemplateParseErrorKind.NoSuchKeyword(name), span);
    }

    static TemplateParseException noSuchFunction(FunctionCallNode function) {
        return new TemplateParseException(
                new TemplateParseErrorKind.NoSuchFunction(function.name()), function.nameSpan());
    }

    static TemplateParseException noSuchMethod(String typeName, FunctionCallNode function) {
        return new TemplateParseException(
                new TemplateParseErrorKind.NoSuchMethod(typeName, function.name()), function.nameSpan());
    }

    static TemplateParseException invalidArgumentCountExact(int count, FunctionCallNode function) {
        return new TemplateParseException(
                new TemplateParseErrorKind.InvalidArgumentCountExact(count), function.argsSpan());
    }

    static TemplateParseException invalidArgumentCountRange(int min, int max, FunctionCallNode function) {
        return new TemplateParseException(
                new TemplateParseErrorKind.InvalidArgumentCountRange(min, max), function.argsSpan());
    }

    static TemplateParseException invalidArgumentCountRangeFrom(int min, FunctionCallNode function) {
        return new TemplateParseException(
                new TemplateParseErrorKind.InvalidArgumentCountRangeFrom(min), function.argsSpan());
    }

    static TemplateParseException invalidArgumentType(String expectedType, SourceSpan span) {
        return new TemplateParseException(new TemplateParseErrorKind.InvalidArgumentType(expectedType), span);
    }
}
