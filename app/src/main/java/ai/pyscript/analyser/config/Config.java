package ai.pyscript.analyser.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings for one analyser run, assembled from CLI arguments and environment values.
 */
public record Config(
        Path inputFile,
        LogFormat logFormat,
        boolean verbose,
        boolean showSource,
        int indentWidth
) {

    public Config {
        Objects.requireNonNull(inputFile, "inputFile");
        Objects.requireNonNull(logFormat, "logFormat");
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be greater than zero");
        }
    }
}
