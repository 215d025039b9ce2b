package ai.pyscript.analyser.structure;

import ai.pyscript.analyser.classify.LineClassifier;
import ai.pyscript.analyser.source.Line;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class SourceFileParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceFileParser.class);

    private SourceFileParser() {
    }

    static SourceFile parse(String name, List<Line> lines) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(lines, "lines");

        List<String> imports = new ArrayList<>();
        List<Assignment> globalVariables = new ArrayList<>();
        List<FunctionDefinition> functions = new ArrayList<>();
        List<ClassDefinition> classes = new ArrayList<>();

        new BlockScanner()
                .track(text -> LineClassifier.matchFunctionHeader(text).isPresent(),
                        block -> functions.add(FunctionParser.parse(block)))
                .track(text -> LineClassifier.matchClassHeader(text).isPresent(),
                        block -> classes.add(ClassParser.parse(block)))
                .scan(lines, 0, line -> classifyTopLevel(line, imports, globalVariables));

        LOGGER.debug("Decomposed {}: {} imports, {} global variables, {} functions, {} classes",
                name, imports.size(), globalVariables.size(), functions.size(), classes.size());
        return new SourceFile(name, imports, globalVariables, functions, classes);
    }

    private static void classifyTopLevel(Line line, List<String> imports, List<Assignment> globalVariables) {
        Optional<List<String>> importedNames = LineClassifier.matchImport(line);
        if (importedNames.isPresent()) {
            imports.addAll(importedNames.get());
            return;
        }
        if (LineClassifier.matchGlobalAssignmentShape(line.text())) {
            Optional<Assignment> assignment = Assignment.from(line);
            if (assignment.isPresent()) {
                globalVariables.add(assignment.get());
            } else {
                LOGGER.debug("Line {} looks like an assignment but has no single assignment sign: '{}'",
                        line.number(), line.text());
            }
        }
    }
}
