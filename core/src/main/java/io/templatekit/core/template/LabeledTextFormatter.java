package io.templatekit.core.template;

import io.templatekit.core.spi.Formatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects output as {@link RenderedText}. Consecutive writes under the same label stack are
 * merged into one segment; empty writes are dropped.
 */
public final class LabeledTextFormatter implements Formatter {

    private final List<String> labels = new ArrayList<>();
    private final List<RenderedText.Segment> segments = new ArrayList<>();

    @Override
    public void write(String text) {
        if (text.isEmpty()) {
            return;
        }
        int last = segments.size() - 1;
        if (last >= 0 && segments.get(last).labels().equals(labels)) {
            var previous = segments.get(last);
            segments.set(last, new RenderedText.Segment(previous.text() + text, labels));
        } else {
            segments.add(new RenderedText.Segment(text, labels));
        }
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

    public RenderedText result() {
        return new RenderedText(segments);
    }
}
