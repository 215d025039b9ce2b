package ai.pyscript.analyser.structure;

import ai.pyscript.analyser.classify.ClassHeader;
import ai.pyscript.analyser.classify.LineClassifier;
import ai.pyscript.analyser.source.Line;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ClassParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClassParser.class);

    private ClassParser() {
    }

    static ClassDefinition parse(List<Line> block) {
        Objects.requireNonNull(block, "block");
        List<Line> lines = block.stream()
                .filter(line -> !line.isBlank())
                .collect(Collectors.toList());
        if (lines.isEmpty()) {
            LOGGER.warn("Cannot build a class from an empty block");
            return new ClassDefinition("", "", List.of(), List.of(), List.of());
        }

        Line headerLine = lines.get(0);
        Optional<ClassHeader> header = LineClassifier.matchClassHeader(headerLine.text());
        if (header.isEmpty()) {
            LOGGER.warn("Invalid class definition on line {}: '{}'", headerLine.number(), headerLine.text());
        }
        String name = header.map(ClassHeader::name).orElse("");
        String parent = header.map(ClassHeader::rawParent).orElse("");

        List<Assignment> variables = collectVariables(lines);
        List<FunctionDefinition> methods = new ArrayList<>();
        List<ClassDefinition> classes = new ArrayList<>();
        new BlockScanner()
                .track(text -> LineClassifier.matchFunctionHeader(text).isPresent(),
                        method -> methods.add(FunctionParser.parse(method)))
                .track(text -> LineClassifier.matchClassHeader(text).isPresent(),
                        nested -> classes.add(parse(nested)))
                .scan(lines, 1, line -> {
                    // variables were collected above
                });

        return new ClassDefinition(name, parent, variables, methods, classes);
    }

    private static List<Assignment> collectVariables(List<Line> lines) {
        List<Assignment> variables = new ArrayList<>();
        if (lines.size() < 2) {
            return variables;
        }
        int memberIndentation = lines.get(1).indentation();
        for (Line line : lines) {
            if (LineClassifier.matchClassVariableShape(line.text(), memberIndentation)) {
                Assignment.from(line).ifPresent(variables::add);
            }
        }
        return variables;
    }
}
