package ai.pyscript.analyser.classify;

import java.util.Objects;

/**
 * Parts of a {@code class Name(parents):} line. The parent list is kept unparsed and is empty when the
 * header has no parentheses.
 */
public record ClassHeader(int indentation, String name, String rawParent) {

    public ClassHeader {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rawParent, "rawParent");
    }
}
