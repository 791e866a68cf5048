package io.templatekit.core.template;

import io.templatekit.core.spi.Formatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Joins non-empty contents with a separator. Contents that render no text are dropped, so there
 * are never leading, trailing or doubled separators.
 */
public final class SeparateTemplate<C> implements Template<C> {

    private final Template<C> separator;
    private final List<Template<C>> contents;

    public SeparateTemplate(Template<C> separator, List<Template<C>> contents) {
        this.separator = Objects.requireNonNull(separator, "separator must not be null");
        this.contents = List.copyOf(contents);
    }

    @Override
    public void format(C context, Formatter formatter) {
        List<FormatRecorder> nonEmpty = new ArrayList<>(contents.size());
        for (Template<C> content : contents) {
            var recorder = new FormatRecorder();
            content.format(context, recorder);
            if (!recorder.isEmpty()) {
                nonEmpty.add(recorder);
            }
        }
        for (int i = 0; i < nonEmpty.size(); i++) {
            if (i > 0) {
                separator.format(context, formatter);
            }
            nonEmpty.get(i).replay(formatter);
        }
    }
}
