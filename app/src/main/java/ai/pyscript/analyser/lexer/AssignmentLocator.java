package ai.pyscript.analyser.lexer;

import java.util.OptionalInt;

/**
 * Finds the {@code =} of a plain assignment without an expression grammar.
 *
 * <p>Signs inside quotes or brackets, and signs that close an operator such as {@code <=}, {@code !=} or
 * {@code +=}, are never candidates. A line carrying two candidates (chained assignment, {@code ==}) is not
 * treated as an assignment.
 */
public final class AssignmentLocator {

    private static final String OPERATOR_PREFIXES = "><!+-";

    private AssignmentLocator() {
    }

    public static OptionalInt locate(String text) {
        if (text == null) {
            return OptionalInt.empty();
        }
        LexicalState state = new LexicalState();
        int signIndex = -1;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            state.consume(ch);
            if (ch != '=') {
                continue;
            }
            if (i == 0) {
                return OptionalInt.empty();
            }
            if (OPERATOR_PREFIXES.indexOf(text.charAt(i - 1)) >= 0) {
                continue;
            }
            if (state.atTopLevel()) {
                if (signIndex >= 0) {
                    return OptionalInt.empty();
                }
                signIndex = i;
            }
        }
        return signIndex >= 0 ? OptionalInt.of(signIndex) : OptionalInt.empty();
    }
}
