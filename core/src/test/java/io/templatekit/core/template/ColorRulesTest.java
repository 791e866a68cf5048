package io.templatekit.core.template;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class ColorRulesTest {

    private final ColorRules rules = ColorRules.builder()
            .rule("commit_id", AnsiColor.BLUE)
            .rule("working_copy commit_id", AnsiColor.BRIGHT_GREEN)
            .rule("prefix", AnsiColor.MAGENTA)
            .rule("rest", AnsiColor.BRIGHT_BLACK)
            .build();

    @Test
    void singleLabelRuleMatchesAnywhereOnTheStack() {
        assertThat(rules.colorFor(List.of("commit_id"))).contains(AnsiColor.BLUE);
        assertThat(rules.colorFor(List.of("commit_id", "short"))).contains(AnsiColor.BLUE);
    }

    @Test
    void moreSpecificRuleWins() {
        assertThat(rules.colorFor(List.of("working_copy", "commit_id", "short"))).contains(AnsiColor.BRIGHT_GREEN);
    }

    @Test
    void laterRuleWinsATie() {
        assertThat(rules.colorFor(List.of("commit_id", "shortest", "prefix"))).contains(AnsiColor.MAGENTA);
        assertThat(rules.colorFor(List.of("prefix", "rest"))).contains(AnsiColor.BRIGHT_BLACK);
    }

    @Test
    void noMatchingRuleMeansNoColor() {
        assertThat(rules.colorFor(List.of("description"))).isEmpty();
        assertThat(rules.colorFor(List.of())).isEmpty();
        assertThat(ColorRules.empty().colorFor(List.of("commit_id"))).isEmpty();
    }

    @Test
    void ruleKeySplitsOnWhitespace() {
        ColorRules parsed = ColorRules.builder().rule("  a   b ", AnsiColor.RED).build();

        assertThat(parsed.rules()).containsExactly(new ColorRules.Rule(List.of("a", "b"), AnsiColor.RED));
    }

    @Test
    void colorNamesParseCaseAndSpaceInsensitively() {
        assertThat(AnsiColor.parse("bright green")).contains(AnsiColor.BRIGHT_GREEN);
        assertThat(AnsiColor.parse(" Blue ")).contains(AnsiColor.BLUE);
        assertThat(AnsiColor.parse("pink")).isEmpty();
    }
}
