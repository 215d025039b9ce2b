package ai.pyscript.analyser.structure;

import ai.pyscript.analyser.source.Line;
import java.util.List;
import java.util.Objects;

/**
 * The recovered skeleton of one script: imported names, top-level variables, functions and classes.
 */
public record SourceFile(String name,
                         List<String> imports,
                         List<Assignment> globalVariables,
                         List<FunctionDefinition> functions,
                         List<ClassDefinition> classes) {

    public SourceFile {
        Objects.requireNonNull(name, "name");
        imports = List.copyOf(Objects.requireNonNull(imports, "imports"));
        globalVariables = List.copyOf(Objects.requireNonNull(globalVariables, "globalVariables"));
        functions = List.copyOf(Objects.requireNonNull(functions, "functions"));
        classes = List.copyOf(Objects.requireNonNull(classes, "classes"));
    }

    /**
     * Decomposes a whole script. Never fails: malformed headers and imports are logged and degrade to
     * placeholders or dropped entries.
     *
     * @param name  module name, usually the file name without its extension
     * @param lines every line of the script in order, blank lines included
     */
    public static SourceFile parse(String name, List<Line> lines) {
        return SourceFileParser.parse(name, lines);
    }
}
