package io.templatekit.core.template;

import io.templatekit.core.spi.Formatter;
import java.util.ArrayList;
import java.util.List;

/** Records formatter calls so they can be inspected and replayed into another formatter later. */
public final class FormatRecorder implements Formatter {

    private sealed interface Operation {}

    private record Write(String text) implements Operation {}

    private record PushLabel(String label) implements Operation {}

    private record PopLabel() implements Operation {}

    private final List<Operation> operations = new ArrayList<>();
    private boolean wroteText;

    @Override
    public void write(String text) {
        operations.add(new Write(text));
        wroteText |= !text.isEmpty();
    }

    @Override
    public void pushLabel(String label) {
        operations.add(new PushLabel(label));
    }

    @Override
    public void popLabel() {
        operations.add(new PopLabel());
    }

    /** True when no non-empty text was written; label operations alone do not count. */
    public boolean isEmpty() {
        return !wroteText;
    }

    public void replay(Formatter formatter) {
        for (Operation operation : operations) {
            if (operation instanceof Write write) {
                formatter.write(write.text());
            } else if (operation instanceof PushLabel push) {
                formatter.pushLabel(push.label());
            } else {
                formatter.popLabel();
            }
        }
    }
}
