package io.templatekit.core.model;

import io.templatekit.core.spi.Formattable;
import io.templatekit.core.spi.Formatter;
import java.util.Objects;

/**
 * An id split at its shortest unique prefix. {@code rest} holds any extra digits shown after the
 * prefix. Renders {@code prefix} under label {@code "prefix"} and {@code rest} under {@code
 * "rest"}.
 */
public record ShortestIdPrefix(String prefix, String rest) implements Formattable {

    public ShortestIdPrefix {
        Objects.requireNonNull(prefix, "prefix must not be null");
        Objects.requireNonNull(rest, "rest must not be null");
    }

    /** {@code prefix[rest]}, or just {@code prefix} when there is no rest. */
    public String withBrackets() {
        return rest.isEmpty() ? prefix : prefix + "[" + rest + "]";
    }

    @Override
    public void format(Formatter formatter) {
        formatter.pushLabel("prefix");
        formatter.write(prefix);
        formatter.popLabel();
        formatter.pushLabel("rest");
        formatter.write(rest);
        formatter.popLabel();
    }

    @Override
    public String toString() {
        return prefix + rest;
    }
}
