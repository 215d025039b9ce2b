package ai.pyscript.analyser.lexer;

/**
 * Quote and bracket bookkeeping for a single left-to-right pass over a line.
 *
 * <p>Quotes toggle only when not escaped by a preceding backslash and not inside the other quote kind.
 * Depth counters move only outside quotes and may go negative on unbalanced input.
 */
public final class LexicalState {

    private boolean inSingleQuote;
    private boolean inDoubleQuote;
    private boolean escaped;
    private int parenthesisDepth;
    private int bracketDepth;
    private int braceDepth;

    public void consume(char ch) {
        boolean escapedChar = escaped;
        escaped = ch == '\\' && !escapedChar;

        if (ch == '\'' && !escapedChar && !inDoubleQuote) {
            inSingleQuote = !inSingleQuote;
            return;
        }
        if (ch == '"' && !escapedChar && !inSingleQuote) {
            inDoubleQuote = !inDoubleQuote;
            return;
        }
        if (inQuote()) {
            return;
        }
        switch (ch) {
            case '(' -> parenthesisDepth++;
            case ')' -> parenthesisDepth--;
            case '[' -> bracketDepth++;
            case ']' -> bracketDepth--;
            case '{' -> braceDepth++;
            case '}' -> braceDepth--;
            default -> {
            }
        }
    }

    public boolean inQuote() {
        return inSingleQuote || inDoubleQuote;
    }

    public boolean nested() {
        return parenthesisDepth != 0 || bracketDepth != 0 || braceDepth != 0;
    }

    public boolean atTopLevel() {
        return !inQuote() && !nested();
    }
}
