package ai.pyscript.analyser.source;

import ai.pyscript.analyser.structure.SourceFile;
import java.util.List;
import java.util.Objects;

/**
 * Numbered lines of a script together with the module name derived from its file name.
 */
public record LoadedSource(String name, List<Line> lines) {

    public LoadedSource {
        Objects.requireNonNull(name, "name");
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
    }

    public SourceFile parse() {
        return SourceFile.parse(name, lines);
    }
}
