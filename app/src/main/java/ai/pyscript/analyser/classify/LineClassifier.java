package ai.pyscript.analyser.classify;

import ai.pyscript.analyser.source.Line;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateless predicates deciding what a single line looks like.
 */
public final class LineClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineClassifier.class);

    private static final Pattern IMPORT = Pattern.compile("^[ \\t]*import[ \\t]+(?<names>.+)$");
    private static final Pattern FROM_IMPORT =
            Pattern.compile("^[ \\t]*from[ \\t]+(?<module>[\\w.]+)[ \\t]+import[ \\t]+(?<names>.+)$");
    private static final Pattern ALIAS_SEPARATOR = Pattern.compile("\\s+as\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private static final Pattern ASSIGNMENT_SHAPE =
            Pattern.compile("^[A-Za-z_][\\w.]*[ \\t]*(?::[^=]*)?=(?!=).*$");
    private static final Pattern FUNCTION_HEADER = Pattern.compile(
            "^(?<indent>[ \\t]*)(?:async[ \\t]+)?def[ \\t]+(?<name>\\w+)[ \\t]*\\((?<params>.*)\\)"
                    + "[ \\t]*(?:->[^:]*)?:[ \\t]*(?:#.*)?$");
    private static final Pattern CLASS_HEADER = Pattern.compile(
            "^(?<indent>[ \\t]*)class[ \\t]+(?<name>\\w+)[ \\t]*(?:\\((?<parent>.*)\\))?[ \\t]*:[ \\t]*(?:#.*)?$");

    private LineClassifier() {
    }

    public static int indentationLength(String text) {
        int length = 0;
        while (length < text.length() && (text.charAt(length) == ' ' || text.charAt(length) == '\t')) {
            length++;
        }
        return length;
    }

    /**
     * Recognizes {@code import a, b as c} and {@code from m import x as y}. Aliases replace the imported
     * name and the module of a from-import is discarded.
     */
    public static Optional<List<String>> matchImport(Line line) {
        String text = line.text();
        Matcher matcher = FROM_IMPORT.matcher(text);
        if (!matcher.matches()) {
            matcher = IMPORT.matcher(text);
            if (!matcher.matches()) {
                return Optional.empty();
            }
        }
        return Optional.of(resolveNames(line, matcher.group("names")));
    }

    public static boolean matchGlobalAssignmentShape(String text) {
        return ASSIGNMENT_SHAPE.matcher(text).matches();
    }

    public static Optional<FunctionHeader> matchFunctionHeader(String text) {
        Matcher matcher = FUNCTION_HEADER.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new FunctionHeader(matcher.group("indent").length(),
                matcher.group("name"), matcher.group("params")));
    }

    public static Optional<ClassHeader> matchClassHeader(String text) {
        Matcher matcher = CLASS_HEADER.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String parent = matcher.group("parent");
        return Optional.of(new ClassHeader(matcher.group("indent").length(),
                matcher.group("name"), parent == null ? "" : parent.trim()));
    }

    /**
     * Same shape as a global assignment, but only when the line is indented by exactly
     * {@code requiredIndentation} characters.
     */
    public static boolean matchClassVariableShape(String text, int requiredIndentation) {
        if (indentationLength(text) != requiredIndentation) {
            return false;
        }
        return matchGlobalAssignmentShape(text.substring(requiredIndentation));
    }

    private static List<String> resolveNames(Line line, String rawNames) {
        String names = rawNames;
        int comment = names.indexOf('#');
        if (comment >= 0) {
            names = names.substring(0, comment);
        }
        names = names.replace("(", "").replace(")", "").replace("\\", "");

        List<String> resolved = new ArrayList<>();
        for (String entry : names.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = ALIAS_SEPARATOR.split(trimmed);
            String name = parts[parts.length - 1].trim();
            if (WHITESPACE.matcher(name).find()) {
                LOGGER.warn("Ignoring malformed import '{}' on line {}: '{}'", name, line.number(), line.text());
                continue;
            }
            resolved.add(name);
        }
        return resolved;
    }
}
