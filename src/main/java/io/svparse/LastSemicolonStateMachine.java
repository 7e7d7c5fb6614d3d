package io.svparse;

import java.util.*;

import org.antlr.v4.runtime.*;

/**
 * Remembers the semicolons between a pair of keywords and, when the closing
 * keyword arrives, re-tags the last one. This separates an optional leading
 * list from the construct's final item, as in property_declaration and
 * sequence_declaration:
 * <pre>
 *   property p; int v; v == 1; a |-> b endproperty
 *                            ^ re-tagged
 * </pre>
 * Both declarations accept an optional ';' right before the closing keyword;
 * that one does not count as the last.
 */
class LastSemicolonStateMachine {

    enum State {
        NONE,
        ACTIVE  // between the two keywords
    }

    private final int triggerTokenType;
    private final int finishTokenType;
    private final int semicolonReplacement;

    private State state = State.NONE;

    // Only the last two entries are ever examined.
    private final Stack<WritableToken> semicolons = new Stack<>();

    // one token look-back
    private Token previousToken;

    LastSemicolonStateMachine(int trigger, int finish, int replacement) {
        this.triggerTokenType = trigger;
        this.finishTokenType = finish;
        this.semicolonReplacement = replacement;
    }

    void updateState(WritableToken token) {
        switch (state) {
            case NONE:
                if (token.getType() == triggerTokenType) {
                    state = State.ACTIVE;
                }
                break;
            case ACTIVE:
                if (token.getType() == SystemVerilogLexer.SEMICOLON) {
                    semicolons.push(token);
                } else if (token.getType() == finishTokenType) {
                    if (previousToken != null
                            && previousToken.getType() == SystemVerilogLexer.SEMICOLON
                            && !semicolons.isEmpty()) {
                        // the optional ';' before the closing keyword
                        semicolons.pop();
                    }
                    if (!semicolons.isEmpty()) {
                        semicolons.peek().setType(semicolonReplacement);
                    }
                    semicolons.clear();
                    state = State.NONE;
                }
                break;
        }
        previousToken = token;
    }

    boolean isActive() {
        return state == State.ACTIVE;
    }

    List<WritableToken> pendingSemicolons() {
        return Collections.unmodifiableList(semicolons);
    }
}
