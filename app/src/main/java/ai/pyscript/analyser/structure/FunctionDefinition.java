package ai.pyscript.analyser.structure;

import ai.pyscript.analyser.source.Line;
import java.util.List;
import java.util.Objects;

/**
 * A {@code def} block: its name, normalized parameters, the functions defined inside it and the lines it
 * was built from.
 */
public record FunctionDefinition(String name,
                                 List<String> parameters,
                                 List<FunctionDefinition> functions,
                                 List<Line> source) {

    public FunctionDefinition {
        Objects.requireNonNull(name, "name");
        parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
        functions = List.copyOf(Objects.requireNonNull(functions, "functions"));
        source = List.copyOf(Objects.requireNonNull(source, "source"));
    }

    /**
     * Builds a function from a captured block whose first line is the header. A block without a valid
     * header yields {@link #placeholder()}.
     */
    public static FunctionDefinition fromBlock(List<Line> block) {
        return FunctionParser.parse(block);
    }

    public static FunctionDefinition placeholder() {
        return new FunctionDefinition("", List.of(), List.of(), List.of());
    }
}
