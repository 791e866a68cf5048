package io.templatekit.core.template;

import io.templatekit.core.spi.Formatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writes text with ANSI color escapes chosen by {@link ColorRules}. Each run of text with the same
 * color is wrapped in {@code ESC[<code>m ... ESC[0m}; uncolored text is written as-is.
 */
public final class ColorFormatter implements Formatter {

    private static final String RESET = "\u001b[0m";

    private final ColorRules rules;
    private final List<String> labels = new ArrayList<>();
    private final StringBuilder buffer = new StringBuilder();
    private AnsiColor current;

    public ColorFormatter(ColorRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
    }

    @Override
    public void write(String text) {
        if (text.isEmpty()) {
            return;
        }
        AnsiColor color = rules.colorFor(labels).orElse(null);
        if (color != current) {
            if (current != null) {
                buffer.append(RESET);
            }
            if (color != null) {
                buffer.append("\u001b[").append(color.code()).append('m');
            }
            current = color;
        }
        buffer.append(text);
    }

    @Override
    public void pushLabel(String label) {
        labels.add(label);
    }

    @Override
    public void popLabel() {
        if (labels.isEmpty()) {
            throw new IllegalStateException("popLabel() without matching pushLabel()");
        }
        labels.remove(labels.size() - 1);
    }

    /** The output so far, with any open color closed. */
    public String text() {
        return current == null ? buffer.toString() : buffer + RESET;
    }
}
