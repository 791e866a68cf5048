package io.templatekit.core.template;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Rendered output with styling metadata: text runs tagged with the label stack that was active
 * when each run was written.
 */
public record RenderedText(List<Segment> segments) {

    public RenderedText {
        segments = List.copyOf(segments);
    }

    /** A run of text and the labels active for it, outermost first. */
    public record Segment(String text, List<String> labels) {

        public Segment {
            Objects.requireNonNull(text, "text must not be null");
            labels = List.copyOf(labels);
        }
    }

    /** All text with labels dropped. */
    public String plainText() {
        return segments.stream().map(Segment::text).collect(Collectors.joining());
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }
}
