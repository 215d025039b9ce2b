package ai.pyscript.analyser.classify;

import java.util.Objects;

/**
 * Parts of a {@code def name(params):} line.
 */
public record FunctionHeader(int indentation, String name, String rawParameters) {

    public FunctionHeader {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rawParameters, "rawParameters");
    }
}
