package ai.pyscript.analyser.source;

import ai.pyscript.analyser.classify.LineClassifier;
import ai.pyscript.analyser.lexer.AssignmentLocator;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * One physical line of a script, numbered from 1 and stored without its line terminator.
 */
public record Line(int number, String text) {

    public Line {
        if (number < 1) {
            throw new IllegalArgumentException("Line number must be positive: " + number);
        }
        Objects.requireNonNull(text, "text");
    }

    public int indentation() {
        return LineClassifier.indentationLength(text);
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    /**
     * Locates the sign of a plain assignment on this line.
     *
     * @return the character offset of the qualifying {@code =}, or empty when the line is not an assignment
     */
    public OptionalInt isAssignment() {
        return AssignmentLocator.locate(text);
    }
}
