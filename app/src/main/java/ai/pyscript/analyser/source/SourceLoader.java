package ai.pyscript.analyser.source;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a script from disk into numbered lines.
 */
public class SourceLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceLoader.class);

    static final String SCRIPT_EXTENSION = ".py";

    public LoadedSource load(Path path) {
        Objects.requireNonNull(path, "path");
        String fileName = path.getFileName() != null ? path.getFileName().toString() : path.toString();
        if (!fileName.toLowerCase(Locale.ROOT).endsWith(SCRIPT_EXTENSION)) {
            LOGGER.warn("File '{}' does not have the {} extension; analysing it anyway", path, SCRIPT_EXTENSION);
        }
        try {
            List<String> texts = Files.readAllLines(path, StandardCharsets.UTF_8);
            LOGGER.debug("Read {} lines from {}", texts.size(), path);
            return new LoadedSource(moduleName(fileName), toLines(texts));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read script: " + path, ex);
        }
    }

    public static List<Line> toLines(List<String> texts) {
        List<Line> lines = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            lines.add(new Line(i + 1, texts.get(i)));
        }
        return lines;
    }

    static String moduleName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
