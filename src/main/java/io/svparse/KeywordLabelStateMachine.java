package io.svparse;

/**
 * Tracks the optional ": label" that may follow begin/end-like keywords,
 * so that a label is not mistaken for the start of a new item.
 */
class KeywordLabelStateMachine {

    enum State {
        ITEM_START,                  // could be the start of an item
        ITEM_MIDDLE,                 // after the start of an item
        GOT_LABELABLE_KEYWORD,
        GOT_COLON_EXPECTING_LABEL
    }

    private State state = State.ITEM_START;

    void updateState(int tokenType) {
        // Any labelable keyword resets, regardless of state.
        if (VerilogTokenClassifications.keywordAcceptsOptionalLabel(tokenType)) {
            state = State.GOT_LABELABLE_KEYWORD;
            return;
        }
        switch (state) {
            case ITEM_START:
                state = State.ITEM_MIDDLE;
                break;
            case ITEM_MIDDLE:
                break;
            case GOT_LABELABLE_KEYWORD:
                if (tokenType == SystemVerilogLexer.COLON) {
                    state = State.GOT_COLON_EXPECTING_LABEL;
                } else {
                    state = State.ITEM_START;
                }
                break;
            case GOT_COLON_EXPECTING_LABEL:
                // The label itself is not checked to be an identifier.
                state = State.ITEM_START;
                break;
        }
    }

    /** True if a statement or item could start in the current state. */
    boolean itemMayStart() {
        return state == State.ITEM_START || state == State.GOT_LABELABLE_KEYWORD;
    }

    State getState() { return state; }
}
