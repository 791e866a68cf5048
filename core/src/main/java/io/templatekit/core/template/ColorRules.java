package io.templatekit.core.template;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps label stacks to colors. A rule is a set of labels; it applies when every one of its labels
 * is on the stack. Among applicable rules the one with the most labels wins, and the rule declared
 * later wins a tie.
 *
 * <p>Immutable and thread-safe.
 */
public final class ColorRules {

    private static final ColorRules EMPTY = new ColorRules(List.of());

    /** One rule: its labels and the color they select. */
    public record Rule(List<String> labels, AnsiColor color) {

        public Rule {
            labels = List.copyOf(labels);
            Objects.requireNonNull(color, "color must not be null");
        }
    }

    private final List<Rule> rules;

    private ColorRules(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static ColorRules empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Rule> rules() {
        return rules;
    }

    /** Color for text written under {@code labelStack}, if any rule applies. */
    public Optional<AnsiColor> colorFor(List<String> labelStack) {
        Rule best = null;
        for (Rule rule : rules) {
            if (labelStack.containsAll(rule.labels())
                    && (best == null || rule.labels().size() >= best.labels().size())) {
                best = rule;
            }
        }
        return Optional.ofNullable(best).map(Rule::color);
    }

    /** Accumulates rules in declaration order. */
    public static final class Builder {

        private final List<Rule> rules = new ArrayList<>();

        Builder() {}

        /**
         * Adds a rule.
         *
         * @param labelKey whitespace-separated labels, e.g. {@code "working_copy commit_id"}
         * @param color color applied when all labels are active
         * @return this builder (fluent)
         */
        public Builder rule(String labelKey, AnsiColor color) {
            List<String> labels = Arrays.asList(labelKey.trim().split("\\s+"));
            rules.add(new Rule(labels, color));
            return this;
        }

        public ColorRules build() {
            return new ColorRules(rules);
        }
    }
}
