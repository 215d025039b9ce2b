package ai.pyscript.analyser.structure;

import ai.pyscript.analyser.source.Line;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A {@code class} block with its class-level variables, methods and nested classes. The parent list is
 * kept exactly as written between the header's parentheses.
 */
public record ClassDefinition(String name,
                              String parent,
                              List<Assignment> variables,
                              List<FunctionDefinition> methods,
                              List<ClassDefinition> classes) {

    private static final int NESTING_WIDTH = 4;

    public ClassDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(parent, "parent");
        variables = List.copyOf(Objects.requireNonNull(variables, "variables"));
        methods = List.copyOf(Objects.requireNonNull(methods, "methods"));
        classes = List.copyOf(Objects.requireNonNull(classes, "classes"));
    }

    /**
     * Builds a class from a captured block whose first line is the header. Blank lines are dropped before
     * the body is scanned.
     */
    public static ClassDefinition fromBlock(List<Line> block) {
        return ClassParser.parse(block);
    }

    /**
     * Reassembles the lines this class was recovered from: method bodies, nested classes and variable
     * lines in line order, behind a synthetic header placed one line above the first of them. Lines that
     * belong to none of these are not part of the view.
     */
    public List<Line> source() {
        List<Line> children = new ArrayList<>();
        methods.forEach(method -> children.addAll(method.source()));
        classes.forEach(nested -> children.addAll(nested.source()));
        variables.forEach(variable -> children.add(variable.source()));
        if (children.isEmpty()) {
            return List.of();
        }
        children.sort(Comparator.comparingInt(Line::number));

        Line first = children.get(0);
        int headerIndentation = Math.max(0, first.indentation() - NESTING_WIDTH);
        String headerText = " ".repeat(headerIndentation) + "class " + name
                + (parent.isEmpty() ? "" : "(" + parent + ")") + ":";

        List<Line> view = new ArrayList<>(children.size() + 1);
        view.add(new Line(Math.max(1, first.number() - 1), headerText));
        view.addAll(children);
        return List.copyOf(view);
    }
}
