package ai.pyscript.analyser.cli;

import ai.pyscript.analyser.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "python-script-analyser", mixinStandardHelpOptions = true, version = "python-script-analyser 0.1.0",
        description = "Prints the imports, global variables, functions and classes of a Python script")
public class CliArguments {

    @CommandLine.Parameters(index = "0", description = "Python script to analyse", paramLabel = "FILE")
    private Path inputFile;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log debug diagnostics")
    private boolean verbose;

    @CommandLine.Option(names = "--show-source", description = "Print the numbered source lines of every function")
    private boolean showSource;

    @CommandLine.Option(names = "--indent-width", description = "Spaces per outline level", paramLabel = "COUNT")
    private Integer indentWidth;

    public Path inputFile() {
        return inputFile;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }

    public boolean showSource() {
        return showSource;
    }

    public Integer indentWidth() {
        return indentWidth;
    }
}
