package ai.pyscript.analyser.structure;

import ai.pyscript.analyser.classify.FunctionHeader;
import ai.pyscript.analyser.classify.LineClassifier;
import ai.pyscript.analyser.lexer.ParameterListSplitter;
import ai.pyscript.analyser.source.Line;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class FunctionParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(FunctionParser.class);

    private FunctionParser() {
    }

    static FunctionDefinition parse(List<Line> block) {
        Objects.requireNonNull(block, "block");
        if (block.isEmpty()) {
            LOGGER.warn("Cannot build a function from an empty block");
            return FunctionDefinition.placeholder();
        }
        Line headerLine = block.get(0);
        Optional<FunctionHeader> header = LineClassifier.matchFunctionHeader(headerLine.text());
        if (header.isEmpty()) {
            LOGGER.warn("Invalid function definition on line {}: '{}'", headerLine.number(), headerLine.text());
            return FunctionDefinition.placeholder();
        }

        List<String> parameters = ParameterListSplitter.split(header.get().rawParameters());
        List<FunctionDefinition> functions = new ArrayList<>();
        new BlockScanner()
                .track(text -> LineClassifier.matchFunctionHeader(text).isPresent(),
                        nested -> functions.add(parse(nested)))
                .scan(block, 1, line -> {
                });

        return new FunctionDefinition(header.get().name(), parameters, functions, block);
    }
}
