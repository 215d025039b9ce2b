package ai.pyscript.analyser.config;

import ai.pyscript.analyser.cli.CliArguments;
import java.util.Objects;

/**
 * Builds a {@link Config} from CLI arguments, falling back to environment variables and then defaults.
 */
public class ConfigLoader {

    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_VERBOSE = "VERBOSE";
    static final String ENV_SHOW_SOURCE = "SHOW_SOURCE";
    static final String ENV_PRINT_INDENT_WIDTH = "PRINT_INDENT_WIDTH";

    private static final int DEFAULT_INDENT_WIDTH = 4;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.inputFile() == null) {
            throw new IllegalArgumentException("a script file must be provided");
        }
        LogFormat logFormat = resolveLogFormat(arguments);
        boolean verbose = arguments.verbose() || resolveFlag(ENV_VERBOSE);
        boolean showSource = arguments.showSource() || resolveFlag(ENV_SHOW_SOURCE);
        int indentWidth = resolveIndentWidth(arguments);
        return new Config(arguments.inputFile(), logFormat, verbose, showSource, indentWidth);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveFlag(String envKey) {
        return environmentReader.get(envKey)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private int resolveIndentWidth(CliArguments arguments) {
        Integer cliWidth = arguments.indentWidth();
        if (cliWidth != null) {
            if (cliWidth < 1) {
                throw new IllegalArgumentException("--indent-width must be greater than zero");
            }
            return cliWidth;
        }
        return environmentReader.get(ENV_PRINT_INDENT_WIDTH)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parsePositiveInteger)
                .orElse(DEFAULT_INDENT_WIDTH);
    }

    private static int parsePositiveInteger(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_PRINT_INDENT_WIDTH + " must be greater than zero");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_PRINT_INDENT_WIDTH + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
