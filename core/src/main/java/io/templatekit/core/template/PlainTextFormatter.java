package io.templatekit.core.template;

import io.templatekit.core.spi.Formatter;

/** Accumulates written text and ignores labels. */
public final class PlainTextFormatter implements Formatter {

    private final StringBuilder buffer = new StringBuilder();

    @Override
    public void write(String text) {
        buffer.append(text);
    }

    @Override
    public void pushLabel(String label) {}

    @Override
    public void popLabel() {}

    public String text() {
        return buffer.toString();
    }
}
