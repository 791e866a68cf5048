package io.templatekit.core.spi;

/**
 * Output sink for rendered templates. Text is written in order; labels form a stack that styling
 * sinks may map to colors. Label pushes and pops are always balanced by the caller.
 *
 * <p>Implementations are not required to be thread-safe; use one formatter per render.
 */
public interface Formatter {

    void write(String text);

    void pushLabel(String label);

    void popLabel();
}
