package io.templatekit.core.syntax;

/** Grammar rules of the template language. Each concrete syntax tree node is tagged with one. */
public enum TemplateRule {
    PROGRAM("program"),
    TEMPLATE("template"),
    TERM("term"),
    FUNCTION("function call"),
    FUNCTION_ARGUMENTS("function arguments"),
    LITERAL("string literal"),
    RAW_LITERAL("raw literal"),
    ESCAPE("escape sequence"),
    INTEGER_LITERAL("integer literal"),
    IDENTIFIER("identifier");

    private final String displayName;

    TemplateRule(String displayName) {
        this.displayName = displayName;
    }

    /** Human-readable name used in "expected ..." syntax error messages. */
    public String displayName() {
        return displayName;
    }
}
