package io.templatekit.core.syntax;

import io.templatekit.core.error.TemplateParseErrorKind;
import io.templatekit.core.error.TemplateParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent PEG parser for the template grammar:
 *
 * <pre>
 * program            := ws* template? ws* EOI
 * template           := term (ws* term)*
 * term               := primary (ws* "." ws* function)*
 * primary            := literal | integer_literal | function | identifier | "(" ws* template ws* ")"
 * function           := identifier "(" ws* function_arguments ws* ")"
 * function_arguments := template (ws* "," ws* template)* (ws* ",")? | ""
 * literal            := '"' (raw_literal | escape)* '"'
 * escape             := "\" ('"' | "\" | "n")
 * integer_literal    := ("0" | [1-9] [0-9]*) !digit
 * identifier         := [A-Za-z] [A-Za-z0-9_]*
 * </pre>
 *
 * <p>Alternatives are ordered; each rule restores the cursor when it fails. {@code template} results
 * are cached per start offset, so a failed call that falls back to identifier plus parenthesized
 * template reuses the nested parse instead of repeating it. On failure of the whole program a
 * {@link TemplateParseErrorKind.SyntaxError} is raised at the furthest position any alternative
 * reached.
 */
public final class TemplateSyntaxParser {

    /** Templates nested deeper than this (through arguments or parentheses) are rejected. */
    public static final int MAX_NESTING_DEPTH = 256;

    private final ParsingContext ctx;
    private int depth;

    private TemplateSyntaxParser(ParsingContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Parses {@code source} into a {@link TemplateRule#PROGRAM} node. The node has a single
     * {@link TemplateRule#TEMPLATE} child, or none when the source is blank.
     *
     * @throws TemplateParseException with a {@code SyntaxError} kind if the text does not match
     */
    public static CstNode.NonTerminal parse(String source) {
        return new TemplateSyntaxParser(ParsingContext.create(source)).parseProgram();
    }

    private CstNode.NonTerminal parseProgram() {
        var start = ctx.location();
        skipWhitespace();
        List<CstNode> children = new ArrayList<>();
        if (parseTemplate() instanceof ParseResult.Success success) {
            children.add(success.node());
            skipWhitespace();
        }
        if (!ctx.isAtEnd()) {
            ctx.updateFurthest("end of input");
            throw new TemplateParseException(
                    new TemplateParseErrorKind.SyntaxError("expected " + ctx.furthestExpected()),
                    SourceSpan.at(ctx.furthestLocation()));
        }
        return new CstNode.NonTerminal(ctx.spanFrom(start), TemplateRule.PROGRAM, children);
    }

    private ParseResult parseTemplate() {
        int startPos = ctx.pos();
        var cached = ctx.cachedAt(TemplateRule.TEMPLATE, startPos);
        if (cached.isPresent()) {
            if (cached.get() instanceof ParseResult.Success success) {
                ctx.restoreLocation(success.node().span().end());
            }
            return cached.get();
        }
        if (depth >= MAX_NESTING_DEPTH) {
            throw new TemplateParseException(
                    new TemplateParseErrorKind.SyntaxError("templates nested deeper than " + MAX_NESTING_DEPTH + " levels"),
                    SourceSpan.at(ctx.location()));
        }
        depth++;
        try {
            var result = parseTemplateUncached();
            ctx.cacheAt(TemplateRule.TEMPLATE, startPos, result);
            return result;
        } finally {
            depth--;
        }
    }

    private ParseResult parseTemplateUncached() {
        var start = ctx.location();
        var first = parseTerm();
        if (first instanceof ParseResult.Failure failure) {
            return failure;
        }
        List<CstNode> terms = new ArrayList<>();
        terms.add(((ParseResult.Success) first).node());
        while (true) {
            var beforeWhitespace = ctx.location();
            skipWhitespace();
            if (parseTerm() instanceof ParseResult.Success next) {
                terms.add(next.node());
            } else {
                ctx.restoreLocation(beforeWhitespace);
                break;
            }
        }
        return ParseResult.success(new CstNode.NonTerminal(ctx.spanFrom(start), TemplateRule.TEMPLATE, terms));
    }

    private ParseResult parseTerm() {
        var start = ctx.location();
        var primary = parsePrimary();
        if (primary instanceof ParseResult.Failure failure) {
            return failure;
        }
        List<CstNode> children = new ArrayList<>();
        children.add(((ParseResult.Success) primary).node());
        while (true) {
            var beforeChain = ctx.location();
            skipWhitespace();
            if (ctx.peek() != '.' || ctx.isAtEnd()) {
                ctx.updateFurthest("'.'");
                ctx.restoreLocation(beforeChain);
                break;
            }
            ctx.advance();
            skipWhitespace();
            if (parseFunction() instanceof ParseResult.Success method) {
                children.add(method.node());
            } else {
                ctx.restoreLocation(beforeChain);
                break;
            }
        }
        return ParseResult.success(new CstNode.NonTerminal(ctx.spanFrom(start), TemplateRule.TERM, children));
    }

    private ParseResult parsePrimary() {
        var start = ctx.location();
        ParseResult result = parseLiteral();
        if (result.isSuccess()) {
            return result;
        }
        result = parseIntegerLiteral();
        if (result.isSuccess()) {
            return result;
        }
        result = parseFunction();
        if (result.isSuccess()) {
            return result;
        }
        result = parseIdentifier();
        if (result.isSuccess()) {
            return result;
        }
        result = parseParenthesized();
        if (result.isSuccess()) {
            return result;
        }
        return ParseResult.failure(start, ctx.furthestExpected());
    }

    private ParseResult parseParenthesized() {
        var start = ctx.location();
        if (ctx.peek() != '(' || ctx.isAtEnd()) {
            return fail(start, "'('");
        }
        ctx.advance();
        skipWhitespace();
        var template = parseTemplate();
        if (template.isFailure()) {
            ctx.restoreLocation(start);
            return template;
        }
        skipWhitespace();
        if (ctx.peek() != ')' || ctx.isAtEnd()) {
            return fail(start, "')'");
        }
        ctx.advance();
        return template;
    }

    private ParseResult parseFunction() {
        var start = ctx.location();
        var name = parseIdentifier();
        if (name.isFailure()) {
            return name;
        }
        if (ctx.peek() != '(' || ctx.isAtEnd()) {
            return fail(start, "'('");
        }
        ctx.advance();
        skipWhitespace();
        var arguments = parseFunctionArguments();
        skipWhitespace();
        if (ctx.peek() != ')' || ctx.isAtEnd()) {
            return fail(start, "')'");
        }
        ctx.advance();
        return ParseResult.success(new CstNode.NonTerminal(
                ctx.spanFrom(start),
                TemplateRule.FUNCTION,
                List.of(((ParseResult.Success) name).node(), arguments)));
    }

    /** Never fails: the empty argument list is a valid match. */
    private CstNode parseFunctionArguments() {
        var start = ctx.location();
        List<CstNode> arguments = new ArrayList<>();
        if (parseTemplate() instanceof ParseResult.Success first) {
            arguments.add(first.node());
            while (true) {
                var beforeComma = ctx.location();
                skipWhitespace();
                if (ctx.peek() != ',' || ctx.isAtEnd()) {
                    ctx.updateFurthest("','");
                    ctx.restoreLocation(beforeComma);
                    break;
                }
                ctx.advance();
                var afterComma = ctx.location();
                skipWhitespace();
                if (parseTemplate() instanceof ParseResult.Success next) {
                    arguments.add(next.node());
                } else {
                    // trailing comma
                    ctx.restoreLocation(afterComma);
                    break;
                }
            }
        }
        return new CstNode.NonTerminal(ctx.spanFrom(start), TemplateRule.FUNCTION_ARGUMENTS, arguments);
    }

    private ParseResult parseLiteral() {
        var start = ctx.location();
        if (ctx.peek() != '"' || ctx.isAtEnd()) {
            return fail(start, TemplateRule.LITERAL.displayName());
        }
        ctx.advance();
        List<CstNode> parts = new ArrayList<>();
        while (true) {
            if (ctx.isAtEnd()) {
                return fail(start, "'\"'");
            }
            char c = ctx.peek();
            if (c == '"') {
                ctx.advance();
                break;
            }
            var partStart = ctx.location();
            if (c == '\\') {
                ctx.advance();
                char escaped = ctx.peek();
                if (ctx.isAtEnd() || (escaped != '"' && escaped != '\\' && escaped != 'n')) {
                    return fail(start, TemplateRule.ESCAPE.displayName());
                }
                ctx.advance();
                parts.add(terminal(partStart, TemplateRule.ESCAPE));
            } else {
                while (!ctx.isAtEnd() && ctx.peek() != '"' && ctx.peek() != '\\') {
                    ctx.advance();
                }
                parts.add(terminal(partStart, TemplateRule.RAW_LITERAL));
            }
        }
        return ParseResult.success(new CstNode.NonTerminal(ctx.spanFrom(start), TemplateRule.LITERAL, parts));
    }

    private ParseResult parseIntegerLiteral() {
        var start = ctx.location();
        char c = ctx.peek();
        if (c == '0' && !ctx.isAtEnd()) {
            ctx.advance();
        } else if (c >= '1' && c <= '9') {
            ctx.advance();
            while (isDigit(ctx.peek())) {
                ctx.advance();
            }
        } else {
            return fail(start, TemplateRule.INTEGER_LITERAL.displayName());
        }
        if (isDigit(ctx.peek())) {
            // leading zero
            ctx.restoreLocation(start);
            return fail(start, TemplateRule.INTEGER_LITERAL.displayName());
        }
        return ParseResult.success(terminal(start, TemplateRule.INTEGER_LITERAL));
    }

    private ParseResult parseIdentifier() {
        var start = ctx.location();
        if (!isLetter(ctx.peek())) {
            return fail(start, TemplateRule.IDENTIFIER.displayName());
        }
        ctx.advance();
        while (isLetter(ctx.peek()) || isDigit(ctx.peek()) || ctx.peek() == '_') {
            ctx.advance();
        }
        return ParseResult.success(terminal(start, TemplateRule.IDENTIFIER));
    }

    private CstNode.Terminal terminal(SourceLocation start, TemplateRule rule) {
        return new CstNode.Terminal(ctx.spanFrom(start), rule, ctx.substring(start.offset(), ctx.pos()));
    }

    /** Records {@code expected} at the current position, then rewinds to {@code start}. */
    private ParseResult fail(SourceLocation start, String expected) {
        ctx.updateFurthest(expected);
        ctx.restoreLocation(start);
        return ParseResult.failure(start, expected);
    }

    private void skipWhitespace() {
        while (!ctx.isAtEnd()) {
            char c = ctx.peek();
            if (c != ' ' && c != '\t' && c != '\r' && c != '\n') {
                return;
            }
            ctx.advance();
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
