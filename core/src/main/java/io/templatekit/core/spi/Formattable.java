package io.templatekit.core.spi;

/**
 * A value with a labelled display form. Values that do not implement this are rendered with
 * {@link Object#toString()}.
 */
public interface Formattable {

    void format(Formatter formatter);
}
