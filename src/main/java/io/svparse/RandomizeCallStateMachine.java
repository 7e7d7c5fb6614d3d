package io.svparse;

import static io.svparse.SystemVerilogLexer.*;

/**
 * Recognizes a randomize_call:
 * <pre>
 *   randomize [ ( [ variable_identifier_list | null ] ) ]
 *             [ with [ ( [ identifier_list ] ) ] constraint_block ]
 * </pre>
 * Once the constraint_block opens, every token is forwarded to a nested
 * {@link ConstraintBlockStateMachine} until it balances.
 */
class RandomizeCallStateMachine {

    enum State {
        NONE,
        GOT_RANDOMIZE_KEYWORD,
        OPENED_VARIABLE_LIST,
        CLOSED_VARIABLE_LIST,
        GOT_WITH_KEYWORD,
        INSIDE_WITH_IDENTIFIER_LIST,
        EXPECT_CONSTRAINT_BLOCK,
        INSIDE_CONSTRAINT_BLOCK
    }

    // randomize calls do not nest inside one another's constraint blocks
    private State state = State.NONE;

    private final ConstraintBlockStateMachine constraintBlockTracker = new ConstraintBlockStateMachine();

    boolean isActive() {
        return state != State.NONE;
    }

    void updateState(int tokenType) {
        switch (state) {
            case NONE:
                if (tokenType == KW_RANDOMIZE) {
                    state = State.GOT_RANDOMIZE_KEYWORD;
                }
                break;
            case GOT_RANDOMIZE_KEYWORD:
                if (tokenType == LPAREN) {
                    state = State.OPENED_VARIABLE_LIST;
                } else if (tokenType == KW_WITH) {
                    state = State.GOT_WITH_KEYWORD;
                } else {
                    state = State.NONE;
                }
                break;
            case OPENED_VARIABLE_LIST:
                if (tokenType == RPAREN) {
                    state = State.CLOSED_VARIABLE_LIST;
                }
                break;
            case CLOSED_VARIABLE_LIST:
                state = tokenType == KW_WITH ? State.GOT_WITH_KEYWORD : State.NONE;
                break;
            case GOT_WITH_KEYWORD:
                if (tokenType == LPAREN) {
                    state = State.INSIDE_WITH_IDENTIFIER_LIST;
                } else if (tokenType == LBRACE) {
                    enterConstraintBlock(tokenType);
                } else {
                    state = State.NONE;
                }
                break;
            case INSIDE_WITH_IDENTIFIER_LIST:
                if (tokenType == RPAREN) {
                    state = State.EXPECT_CONSTRAINT_BLOCK;
                }
                break;
            case EXPECT_CONSTRAINT_BLOCK:
                if (tokenType == LBRACE) {
                    enterConstraintBlock(tokenType);
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

    private void enterConstraintBlock(int tokenType) {
        state = State.INSIDE_CONSTRAINT_BLOCK;
        constraintBlockTracker.updateState(tokenType);
    }

    int interpretToken(int tokenType) {
        if (state == State.INSIDE_CONSTRAINT_BLOCK) {
            return constraintBlockTracker.interpretToken(tokenType);
        }
        return tokenType;
    }

    State getState() { return state; }
}
