package io.svparse;

import static io.svparse.SystemVerilogLexer.*;

/**
 * Recognizes a (non-extern) constraint declaration, {@code constraint NAME { ... }},
 * and forwards the body to a nested {@link ConstraintBlockStateMachine}.
 */
class ConstraintDeclarationStateMachine {

    enum State {
        NONE,
        GOT_CONSTRAINT_KEYWORD,
        GOT_CONSTRAINT_IDENTIFIER,
        INSIDE_CONSTRAINT_BLOCK
    }

    private State state = State.NONE;

    private final ConstraintBlockStateMachine constraintBlockTracker = new ConstraintBlockStateMachine();

    boolean isActive() {
        return state != State.NONE;
    }

    void updateState(int tokenType) {
        switch (state) {
            case NONE:
                if (tokenType == KW_CONSTRAINT) {
                    state = State.GOT_CONSTRAINT_KEYWORD;
                }
                break;
            case GOT_CONSTRAINT_KEYWORD:
                // TODO: accept out-of-line definitions, "constraint cls::name {"
                state = tokenType == SIMPLE_IDENTIFIER || tokenType == ESCAPED_IDENTIFIER
                    ? State.GOT_CONSTRAINT_IDENTIFIER : State.NONE;
                break;
            case GOT_CONSTRAINT_IDENTIFIER:
                if (tokenType == LBRACE) {
                    state = State.INSIDE_CONSTRAINT_BLOCK;
                    constraintBlockTracker.updateState(tokenType);
                } else {
                    state = State.NONE;
                }
                break;
            case INSIDE_CONSTRAINT_BLOCK:
                constraintBlockTracker.updateState(tokenType);
                if (!constraintBlockTracker.isActive()) {
                    state = State.NONE;
                }
                break;
        }
    }

    int interpretToken(int tokenType) {
        if (state == State.INSIDE_CONSTRAINT_BLOCK) {
            return constraintBlockTracker.interpretToken(tokenType);
        }
        return tokenType;
    }

    State getState() { return state; }
}
