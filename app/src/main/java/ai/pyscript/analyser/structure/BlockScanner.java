package ai.pyscript.analyser.structure;

import ai.pyscript.analyser.source.Line;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Drives one or more {@link BlockCapture}s over a line list. An active capture sees each line first; a line
 * it rejects is processed again as an ordinary line. Header shapes are disjoint, so at most one capture is
 * active at any time.
 */
final class BlockScanner {

    private final List<Tracker> trackers = new ArrayList<>();

    BlockScanner track(Predicate<String> header, Consumer<List<Line>> sink) {
        trackers.add(new Tracker(Objects.requireNonNull(header, "header"), new BlockCapture(sink)));
        return this;
    }

    void scan(List<Line> lines, int fromIndex, Consumer<Line> otherLines) {
        for (int i = fromIndex; i < lines.size(); i++) {
            Line line = lines.get(i);
            BlockCapture active = activeCapture();
            if (active != null && active.offer(line)) {
                continue;
            }
            if (line.isBlank()) {
                continue;
            }
            Tracker armed = armedBy(line);
            if (armed != null) {
                armed.capture().start(line);
                continue;
            }
            otherLines.accept(line);
        }
        for (Tracker tracker : trackers) {
            tracker.capture().finish();
        }
    }

    private BlockCapture activeCapture() {
        for (Tracker tracker : trackers) {
            if (tracker.capture().isActive()) {
                return tracker.capture();
            }
        }
        return null;
    }

    private Tracker armedBy(Line line) {
        for (Tracker tracker : trackers) {
            if (tracker.header().test(line.text())) {
                return tracker;
            }
        }
        return null;
    }

    private record Tracker(Predicate<String> header, BlockCapture capture) {
    }
}
