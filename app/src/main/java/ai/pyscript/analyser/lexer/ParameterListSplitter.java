package ai.pyscript.analyser.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the text between a function header's parentheses into normalized parameter tokens.
 */
public final class ParameterListSplitter {

    private ParameterListSplitter() {
    }

    /**
     * Splits on commas outside quotes and brackets, then normalizes every token: spaces outside quotes are
     * removed and a single space is put back after each unquoted comma or colon. Empty tokens are dropped.
     */
    public static List<String> split(String rawParameters) {
        List<String> parameters = new ArrayList<>();
        if (rawParameters == null || rawParameters.isEmpty()) {
            return parameters;
        }
        LexicalState state = new LexicalState();
        StringBuilder token = new StringBuilder();
        for (int i = 0; i < rawParameters.length(); i++) {
            char ch = rawParameters.charAt(i);
            state.consume(ch);
            if (ch == ',' && state.atTopLevel()) {
                addNormalized(parameters, token.toString());
                token.setLength(0);
            } else {
                token.append(ch);
            }
        }
        addNormalized(parameters, token.toString());
        return parameters;
    }

    static String normalize(String token) {
        return respaceSeparators(removeUnquotedSpaces(token));
    }

    private static void addNormalized(List<String> parameters, String token) {
        String normalized = normalize(token);
        if (!normalized.isEmpty()) {
            parameters.add(normalized);
        }
    }

    private static String removeUnquotedSpaces(String token) {
        LexicalState state = new LexicalState();
        StringBuilder result = new StringBuilder(token.length());
        for (int i = 0; i < token.length(); i++) {
            char ch = token.charAt(i);
            state.consume(ch);
            if (ch != ' ' || state.inQuote()) {
                result.append(ch);
            }
        }
        return result.toString();
    }

    private static String respaceSeparators(String token) {
        LexicalState state = new LexicalState();
        StringBuilder result = new StringBuilder(token.length() + 8);
        for (int i = 0; i < token.length(); i++) {
            char ch = token.charAt(i);
            state.consume(ch);
            result.append(ch);
            if ((ch == ',' || ch == ':') && !state.inQuote()) {
                result.append(' ');
            }
        }
        return result.toString();
    }
}
