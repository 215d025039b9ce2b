package ai.pyscript.analyser.cli;

import ai.pyscript.analyser.config.Config;
import ai.pyscript.analyser.config.ConfigLoader;
import ai.pyscript.analyser.config.SystemEnvironmentReader;
import ai.pyscript.analyser.logging.LoggingConfigurator;
import ai.pyscript.analyser.report.StructurePrinter;
import ai.pyscript.analyser.source.LoadedSource;
import ai.pyscript.analyser.source.SourceLoader;
import ai.pyscript.analyser.structure.SourceFile;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point: reads one script, decomposes it and prints the outline to stdout. Diagnostics go to the log.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_UNREADABLE_INPUT = 1;

    private final ConfigLoader configLoader;
    private final SourceLoader sourceLoader;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new SourceLoader());
    }

    CliApplication(ConfigLoader configLoader, SourceLoader sourceLoader) {
        this.configLoader = configLoader;
        this.sourceLoader = sourceLoader;
    }

    public static void main(String[] args) {
        int exitCode = new CliApplication().run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    public int run(String[] args) {
        return run(args, new CommandLine(new CliArguments()));
    }

    int run(String[] args, CommandLine commandLine) {
        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        CliArguments cliArguments = commandLine.getCommand();
        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.debug("Analysing {} (showSource={}, indentWidth={})",
                config.inputFile(), config.showSource(), config.indentWidth());

        LoadedSource source;
        try {
            source = sourceLoader.load(config.inputFile());
        } catch (UncheckedIOException ex) {
            LOGGER.error("Unable to read {}", config.inputFile(), ex);
            commandLine.getErr().println(ex.getMessage());
            return EXIT_UNREADABLE_INPUT;
        }

        SourceFile file = source.parse();
        PrintWriter out = commandLine.getOut();
        out.print(new StructurePrinter(config.indentWidth(), config.showSource()).print(file));
        out.flush();
        return 0;
    }
}
