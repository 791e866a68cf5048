package io.templatekit.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;

import io.templatekit.core.model.ShortestIdPrefix;
import io.templatekit.core.spi.Formatter;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class FormatRecorderTest {

    @Test
    void labelsAloneDoNotMakeTheRecordingNonEmpty() {
        var recorder = new FormatRecorder();
        recorder.pushLabel("x");
        recorder.write("");
        recorder.popLabel();

        assertThat(recorder.isEmpty()).isTrue();
    }

    @Test
    void replayRepeatsCallsInOrder() {
        var recorder = new FormatRecorder();
        new ShortestIdPrefix("ab", "cd").format(recorder);
        Formatter target = mock(Formatter.class);

        recorder.replay(target);

        assertThat(recorder.isEmpty()).isFalse();
        InOrder order = inOrder(target);
        order.verify(target).pushLabel("prefix");
        order.verify(target).write("ab");
        order.verify(target).popLabel();
        order.verify(target).pushLabel("rest");
        order.verify(target).write("cd");
        order.verify(target).popLabel();
        order.verifyNoMoreInteractions();
    }

    @Test
    void labeledTextFormatterMergesRunsUnderTheSameLabels() {
        var formatter = new LabeledTextFormatter();
        formatter.write("a");
        formatter.write("b");
        formatter.pushLabel("x");
        formatter.write("");
        formatter.write("c");
        formatter.popLabel();
        formatter.write("d");

        assertThat(formatter.result().segments())
                .containsExactly(
                        new RenderedText.Segment("ab", List.of()),
                        new RenderedText.Segment("c", List.of("x")),
                        new RenderedText.Segment("d", List.of()));
    }
}
