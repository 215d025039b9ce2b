package ai.pyscript.analyser.structure;

import ai.pyscript.analyser.source.Line;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Collects a header line and the indented block that follows it.
 *
 * <p>The first non-blank line after the header fixes the baseline indentation. The block ends before the
 * first non-blank line indented less than the baseline, or at end of input. Blank lines are kept only when
 * more block content follows them.
 */
public final class BlockCapture {

    private static final int UNSET = -1;

    private final Consumer<List<Line>> sink;
    private final List<Line> captured = new ArrayList<>();
    private final List<Line> pendingBlankLines = new ArrayList<>();
    private boolean active;
    private int baselineIndentation = UNSET;

    public BlockCapture(Consumer<List<Line>> sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public void start(Line header) {
        Objects.requireNonNull(header, "header");
        if (active) {
            throw new IllegalStateException("Capture already active since line " + captured.get(0).number());
        }
        active = true;
        baselineIndentation = UNSET;
        captured.add(header);
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Feeds the next line to an active capture.
     *
     * @return {@code true} when the line belongs to the block, {@code false} when the block ended before it;
     *         in the latter case the block has been handed to the sink and the caller still owns the line
     */
    public boolean offer(Line line) {
        if (!active) {
            throw new IllegalStateException("Capture is not active");
        }
        if (line.isBlank()) {
            pendingBlankLines.add(line);
            return true;
        }
        int indentation = line.indentation();
        if (baselineIndentation == UNSET) {
            baselineIndentation = indentation;
        } else if (indentation < baselineIndentation) {
            close();
            return false;
        }
        captured.addAll(pendingBlankLines);
        pendingBlankLines.clear();
        captured.add(line);
        return true;
    }

    public void finish() {
        if (active) {
            close();
        }
    }

    private void close() {
        List<Line> block = List.copyOf(captured);
        captured.clear();
        pendingBlankLines.clear();
        baselineIndentation = UNSET;
        active = false;
        sink.accept(block);
    }
}
