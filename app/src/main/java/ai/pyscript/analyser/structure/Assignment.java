package ai.pyscript.analyser.structure;

import ai.pyscript.analyser.source.Line;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A single-target assignment read from one line. The name has its type annotation stripped.
 */
public record Assignment(String name, String value, Line source) {

    public Assignment {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(source, "source");
    }

    public static Optional<Assignment> from(Line line) {
        OptionalInt signIndex = line.isAssignment();
        if (signIndex.isEmpty()) {
            return Optional.empty();
        }
        String text = line.text();
        int index = signIndex.getAsInt();
        String target = text.substring(0, index);
        int annotation = target.indexOf(':');
        if (annotation >= 0) {
            target = target.substring(0, annotation);
        }
        return Optional.of(new Assignment(target.trim(), text.substring(index + 1).trim(), line));
    }
}
