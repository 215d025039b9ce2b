package ai.pyscript.analyser.report;

import ai.pyscript.analyser.source.Line;
import ai.pyscript.analyser.structure.Assignment;
import ai.pyscript.analyser.structure.ClassDefinition;
import ai.pyscript.analyser.structure.FunctionDefinition;
import ai.pyscript.analyser.structure.SourceFile;
import java.util.List;

/**
 * Renders a recovered {@link SourceFile} as an indented outline.
 */
public class StructurePrinter {

    private static final String NEWLINE = System.lineSeparator();

    private final int indentWidth;
    private final boolean showSource;

    public StructurePrinter(int indentWidth, boolean showSource) {
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be positive");
        }
        this.indentWidth = indentWidth;
        this.showSource = showSource;
    }

    public String print(SourceFile file) {
        StringBuilder out = new StringBuilder(512);
        append(out, 0, "File: " + file.name());
        if (!file.imports().isEmpty()) {
            append(out, 1, "Imports:");
            file.imports().forEach(name -> append(out, 2, name));
        }
        if (!file.globalVariables().isEmpty()) {
            append(out, 1, "Global variables:");
            file.globalVariables().forEach(variable -> append(out, 2, describe(variable)));
        }
        if (!file.functions().isEmpty()) {
            append(out, 1, "Functions:");
            file.functions().forEach(function -> printFunction(out, 2, function));
        }
        if (!file.classes().isEmpty()) {
            append(out, 1, "Classes:");
            file.classes().forEach(type -> printClass(out, 2, type));
        }
        return out.toString();
    }

    /**
     * Formats a line as {@code Line   12: text}.
     */
    public static String formatLine(Line line) {
        return String.format("Line %4d: %s", line.number(), line.text());
    }

    private void printFunction(StringBuilder out, int depth, FunctionDefinition function) {
        append(out, depth, function.name() + "(" + String.join(", ", function.parameters()) + ")");
        if (showSource) {
            printSource(out, depth + 1, function.source());
        }
        function.functions().forEach(nested -> printFunction(out, depth + 1, nested));
    }

    private void printClass(StringBuilder out, int depth, ClassDefinition type) {
        append(out, depth, type.parent().isEmpty() ? type.name() : type.name() + "(" + type.parent() + ")");
        if (!type.variables().isEmpty()) {
            append(out, depth + 1, "Variables:");
            type.variables().forEach(variable -> append(out, depth + 2, describe(variable)));
        }
        if (!type.methods().isEmpty()) {
            append(out, depth + 1, "Methods:");
            type.methods().forEach(method -> printFunction(out, depth + 2, method));
        }
        if (!type.classes().isEmpty()) {
            append(out, depth + 1, "Classes:");
            type.classes().forEach(nested -> printClass(out, depth + 2, nested));
        }
    }

    private void printSource(StringBuilder out, int depth, List<Line> lines) {
        lines.forEach(line -> append(out, depth, formatLine(line)));
    }

    private static String describe(Assignment assignment) {
        return assignment.name() + " = " + assignment.value();
    }

    private void append(StringBuilder out, int depth, String text) {
        out.append(" ".repeat(depth * indentWidth)).append(text).append(NEWLINE);
    }
}
