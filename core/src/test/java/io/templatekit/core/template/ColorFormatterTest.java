package io.templatekit.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ColorFormatterTest {

    private static final String BLUE = "\u001b[34m";
    private static final String GREEN = "\u001b[32m";
    private static final String RESET = "\u001b[0m";

    private final ColorRules rules = ColorRules.builder()
            .rule("commit_id", AnsiColor.BLUE)
            .rule("branches", AnsiColor.GREEN)
            .build();

    @Test
    void colorsOnlyLabelledText() {
        var formatter = new ColorFormatter(rules);
        formatter.write("id: ");
        formatter.pushLabel("commit_id");
        formatter.write("abc");
        formatter.write("def");
        formatter.popLabel();
        formatter.write(" done");

        assertThat(formatter.text()).isEqualTo("id: " + BLUE + "abcdef" + RESET + " done");
    }

    @Test
    void switchesColorBetweenRuns() {
        var formatter = new ColorFormatter(rules);
        formatter.pushLabel("commit_id");
        formatter.write("abc");
        formatter.popLabel();
        formatter.pushLabel("branches");
        formatter.write("main");
        formatter.popLabel();

        assertThat(formatter.text()).isEqualTo(BLUE + "abc" + RESET + GREEN + "main" + RESET);
    }

    @Test
    void emptyWritesDoNotOpenAColor() {
        var formatter = new ColorFormatter(rules);
        formatter.pushLabel("commit_id");
        formatter.write("");
        formatter.popLabel();

        assertThat(formatter.text()).isEmpty();
    }

    @Test
    void unbalancedPopIsRejected() {
        assertThatThrownBy(() -> new ColorFormatter(rules).popLabel()).isInstanceOf(IllegalStateException.class);
    }
}
