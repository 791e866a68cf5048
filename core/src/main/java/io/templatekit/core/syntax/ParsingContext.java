package io.templatekit.core.syntax;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable cursor over template source text. Tracks the current line and column alongside the
 * offset, and remembers the furthest position at which any alternative failed so that syntax
 * errors point at the most useful location. Rule results are memoized per start position so that
 * backtracking never parses the same rule at the same offset twice.
 *
 * <p>Not thread-safe; one instance per parse call.
 */
public final class ParsingContext {

    private final String input;

    private int pos;
    private int line;
    private int column;

    private int furthestPos;
    private int furthestLine;
    private int furthestColumn;
    private final Set<String> furthestExpected = new LinkedHashSet<>();

    private final Map<Long, ParseResult> packratCache = new HashMap<>();

    private ParsingContext(String input) {
        this.input = input;
        this.line = 1;
        this.column = 1;
        this.furthestLine = 1;
        this.furthestColumn = 1;
    }

    public static ParsingContext create(String input) {
        return new ParsingContext(Objects.requireNonNull(input, "input must not be null"));
    }

    // --- Position management ---

    public int pos() {
        return pos;
    }

    public SourceLocation location() {
        return new SourceLocation(line, column, pos);
    }

    public void restoreLocation(SourceLocation location) {
        this.pos = location.offset();
        this.line = location.line();
        this.column = location.column();
    }

    public SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, location());
    }

    public boolean isAtEnd() {
        return pos >= input.length();
    }

    // --- Character access ---

    /** Returns the current character, or {@code '\0'} at end of input. */
    public char peek() {
        return isAtEnd() ? '\0' : input.charAt(pos);
    }

    public char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    public String substring(int start, int end) {
        return input.substring(start, end);
    }

    // --- Packrat cache ---

    public Optional<ParseResult> cachedAt(TemplateRule rule, int position) {
        return Optional.ofNullable(packratCache.get(packratKey(rule, position)));
    }

    public void cacheAt(TemplateRule rule, int position, ParseResult result) {
        packratCache.put(packratKey(rule, position), result);
    }

    private static long packratKey(TemplateRule rule, int position) {
        return ((long) rule.ordinal() << 32) | position;
    }

    // --- Error tracking ---

    /**
     * Records that {@code expected} could not be matched at the current position. Only the
     * furthest position is kept; alternatives failing at the same position are merged.
     */
    public void updateFurthest(String expected) {
        if (pos > furthestPos) {
            furthestPos = pos;
            furthestLine = line;
            furthestColumn = column;
            furthestExpected.clear();
            furthestExpected.add(expected);
        } else if (pos == furthestPos) {
            furthestExpected.add(expected);
        }
    }

    public SourceLocation furthestLocation() {
        return new SourceLocation(furthestLine, furthestColumn, furthestPos);
    }

    /** Alternatives expected at the furthest failure, joined with {@code " or "}. */
    public String furthestExpected() {
        return String.join(" or ", furthestExpected);
    }
}
