package io.svparse;

import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.svparse.SystemVerilogLexer.*;

/**
 * Tracks position within a constraint_block or constraint_set:
 * <pre>
 *   constraint_block_item : soft/unique/disable/solve ... ;
 *                         | constraint_expression
 *   constraint_expression : expression_or_dist ;
 *                         | expression -> constraint_set
 *                         | if ( ... ) constraint_set [ else constraint_set ]
 *                         | foreach ( ... ) constraint_set
 *   constraint_set        : constraint_expression
 *                         | { { constraint_expression } }
 * </pre>
 * Constraint sets nest, so each level of braces or parentheses is a frame
 * on a stack. The machine is active while the stack is non-empty.
 */
class ConstraintBlockStateMachine {
    private static final Logger LOG = LoggerFactory.getLogger(ConstraintBlockStateMachine.class);

    enum State {
        BLOCK_ITEM_OR_EXPRESSION_START,  // list item (home state)
        // soft ...; unique {...}; disable soft ...; solve ... before ...;
        IGNORE_UNTIL_SEMICOLON,
        EXPRESSION_OR_IMPLICATION,
        GOT_IF,
        GOT_FOREACH,
        // if-clause, else-clause, foreach body, and the RHS of a
        // constraint implication all end with a constraint_set
        EXPECTING_CONSTRAINT_SET,
        IN_PAREN_EXPRESSION,             // balance until ')'
        IN_BRACE_EXPRESSION              // balance until '}'
    }

    private final Stack<State> states = new Stack<>();

    boolean isActive() {
        return !states.isEmpty();
    }

    void updateState(int tokenType) {
        if (!isActive()) {
            if (tokenType == LBRACE) {
                states.push(State.BLOCK_ITEM_OR_EXPRESSION_START);
            }
            return;
        }
        switch (states.peek()) {
            case BLOCK_ITEM_OR_EXPRESSION_START:
                updateBlockItemStart(tokenType);
                break;
            case IN_PAREN_EXPRESSION:
                switch (tokenType) {
                    case LPAREN:
                        states.push(State.IN_PAREN_EXPRESSION);
                        break;
                    case RPAREN:
                        states.pop();
                        break;
                    case LBRACE:
                        states.push(State.IN_BRACE_EXPRESSION);
                        break;
                    default:
                        break;
                }
                break;
            case IN_BRACE_EXPRESSION:
                switch (tokenType) {
                    case LBRACE:
                        states.push(State.IN_BRACE_EXPRESSION);
                        break;
                    case RBRACE:
                        states.pop();
                        break;
                    case LPAREN:
                        states.push(State.IN_PAREN_EXPRESSION);
                        break;
                    default:
                        break;
                }
                break;
            case EXPRESSION_OR_IMPLICATION:
                switch (tokenType) {
                    case LBRACE:
                        states.push(State.IN_BRACE_EXPRESSION);
                        break;
                    case LPAREN:
                        states.push(State.IN_PAREN_EXPRESSION);
                        break;
                    case RBRACE:
                        // not valid here, but may close the enclosing level
                        deferInvalidToken(tokenType);
                        break;
                    case RARROW:
                    case CONSTRAINT_IMPLIES:
                        replaceTop(State.EXPECTING_CONSTRAINT_SET);
                        break;
                    case SEMICOLON:
                        states.pop();
                        break;
                    default:
                        break;
                }
                break;
            case IGNORE_UNTIL_SEMICOLON:
                switch (tokenType) {
                    case LPAREN:
                        states.push(State.IN_PAREN_EXPRESSION);
                        break;
                    case LBRACE:
                        states.push(State.IN_BRACE_EXPRESSION);
                        break;
                    case RPAREN:
                    case RBRACE:
                        deferInvalidToken(tokenType);
                        break;
                    case SEMICOLON:
                        states.pop();
                        break;
                    default:
                        break;
                }
                break;
            case GOT_IF:
            case GOT_FOREACH:
                if (tokenType == LPAREN) {
                    // predicate or loop variables, then a constraint_set
                    replaceTop(State.EXPECTING_CONSTRAINT_SET);
                    states.push(State.IN_PAREN_EXPRESSION);
                } else {
                    deferInvalidToken(tokenType);
                }
                break;
            case EXPECTING_CONSTRAINT_SET:
                if (tokenType == LBRACE) {
                    // Replacing (not pushing) makes the balanced '}' return to
                    // the state that preceded this construct.
                    replaceTop(State.BLOCK_ITEM_OR_EXPRESSION_START);
                } else {
                    // a single constraint_expression
                    states.pop();
                    updateState(tokenType);
                }
                break;
        }
    }

    private void updateBlockItemStart(int tokenType) {
        // Push the item's state so that it pops back here when finished.
        switch (tokenType) {
            case KW_SOFT:
            case KW_UNIQUE:
            case KW_DISABLE:
            case KW_SOLVE:
                states.push(State.IGNORE_UNTIL_SEMICOLON);
                break;
            case KW_IF:
                states.push(State.GOT_IF);
                break;
            case KW_ELSE:
                states.push(State.EXPECTING_CONSTRAINT_SET);
                break;
            case KW_FOREACH:
                states.push(State.GOT_FOREACH);
                break;
            case LPAREN:
                states.push(State.EXPRESSION_OR_IMPLICATION);
                states.push(State.IN_PAREN_EXPRESSION);
                break;
            case LBRACE:
                states.push(State.EXPRESSION_OR_IMPLICATION);
                states.push(State.IN_BRACE_EXPRESSION);
                break;
            case RBRACE:
                // de-activates when this was the outermost level
                states.pop();
                break;
            default:
                states.push(State.EXPRESSION_OR_IMPLICATION);
                break;
        }
    }

    /**
     * On invalid syntax, hands the token to the state below the top, or
     * leaves the machine entirely when no such state remains.
     */
    private void deferInvalidToken(int tokenType) {
        LOG.debug("Deferring unexpected {} in constraint state {}",
            VerilogTokenClassifications.symbolName(tokenType), states.peek());
        states.pop();
        if (isActive()) {
            updateState(tokenType);
        }
    }

    private void replaceTop(State state) {
        states.pop();
        states.push(state);
    }

    /** Returns the disambiguated category for '->'; all others pass through. */
    int interpretToken(int tokenType) {
        if (!isActive() || tokenType != RARROW) {
            return tokenType;
        }
        if (states.peek() == State.EXPRESSION_OR_IMPLICATION) {
            return CONSTRAINT_IMPLIES;
        }
        return LOGICAL_IMPLIES;
    }

    State topState() {
        return states.isEmpty() ? null : states.peek();
    }

    int depth() {
        return states.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(states.size()).append(']');
        if (!states.isEmpty()) {
            sb.append(": top:").append(states.peek());
        }
        return sb.toString();
    }
}
