package io.svparse;

import java.util.*;

import org.antlr.v4.runtime.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.svparse.SystemVerilogLexer.*;

/**
 * Tracks just enough context to re-tag SystemVerilog tokens whose meaning
 * the lexer cannot know on its own. The input is the filtered (default
 * channel) token sequence of one source file; the output is the same
 * sequence with some token types rewritten in place, ready for a parser.
 *
 * <p>This class is itself a state machine that delegates to smaller,
 * concurrent state machines. Those stay inactive most of the time and are
 * switched on by particular keywords. Every transition is total: malformed
 * or partial input degrades the tracking locally and never throws.
 *
 * <p>One instance serves exactly one pass over one file.
 */
public class VerilogLexicalContext {
    private static final Logger LOG = LoggerFactory.getLogger(VerilogLexicalContext.class);

    /** Header/body state of an if, for, or case construct. */
    static final class FlowControlState {
        // false while still inside "if (...)", "for (...)", "case (...)"
        private boolean inBody = false;

        boolean isInBody() { return inBody; }
    }

    private Token previousToken;

    // Non-nestable declarations: a flag pair each, no stack.
    private boolean inModuleDeclaration = false;
    private boolean inModuleBody = false;
    private boolean inFunctionDeclaration = false;
    private boolean inFunctionBody = false;
    private boolean inTaskDeclaration = false;
    private boolean inTaskBody = false;

    // An extern prototype has no body; its ';' ends the declaration.
    private boolean inExternDeclaration = false;

    private boolean previousTokenFinishedHeader = true;

    private boolean inInitialAlwaysFinalConstruct = false;
    private boolean seenDelayValueInProceduralConstruct = false;

    // Only the innermost header is ever consulted and frames are never
    // popped, so a new construct replaces the previous frame.
    private FlowControlState flowControl;

    // Every 'begin' is pushed, every 'end' pops (safely).
    private final Deque<Token> blockStack = new ArrayDeque<>();

    // Open '(' and '{' tokens awaiting their closing partner.
    private final Deque<Token> balanceStack = new ArrayDeque<>();

    private final KeywordLabelStateMachine keywordLabelTracker = new KeywordLabelStateMachine();
    private final RandomizeCallStateMachine randomizeCallTracker = new RandomizeCallStateMachine();
    private final ConstraintDeclarationStateMachine constraintDeclarationTracker =
        new ConstraintDeclarationStateMachine();
    private final LastSemicolonStateMachine propertyDeclarationTracker = new LastSemicolonStateMachine(
        KW_PROPERTY, KW_ENDPROPERTY, SEMICOLON_END_OF_ASSERTION_VARIABLE_DECLARATIONS);
    private final LastSemicolonStateMachine sequenceDeclarationTracker = new LastSemicolonStateMachine(
        KW_SEQUENCE, KW_ENDSEQUENCE, SEMICOLON_END_OF_ASSERTION_VARIABLE_DECLARATIONS);

    // =====================================================================
    // PUBLIC ENTRY POINTS
    // =====================================================================

    /**
     * Re-tags ambiguous tokens in place. The list must hold the tokens a
     * parser would see (no whitespace or comments), in source order.
     * Invalid input is accepted; only valid input is guaranteed to leave
     * no ambiguous token types behind.
     */
    public void transformVerilogSymbols(List<? extends WritableToken> tokens) {
        for (WritableToken token : tokens) {
            advanceToken(token);
        }
    }

    /** Reads one token, possibly re-tagging it, and advances all state. */
    public void advanceToken(WritableToken token) {
        int originalType = token.getType();

        // Decide from the current state only, then update from what was
        // actually lexed, not from the rewrite.
        token.setType(interpretToken(originalType));
        updateState(token, originalType);

        // These re-tag earlier tokens and need the mutable reference.
        propertyDeclarationTracker.updateState(token);
        sequenceDeclarationTracker.updateState(token);

        previousToken = token;
    }

    /**
     * Returns the disambiguated type for a raw token type without changing
     * any state. Unambiguous types are returned unchanged.
     */
    public int interpretToken(int tokenType) {
        switch (tokenType) {
            // '->' is logical implication, constraint implication, or event trigger
            case RARROW:
                if (randomizeCallTracker.isActive()) {
                    // randomize() with { x -> y; }
                    return resolveConstraintArrow(randomizeCallTracker.interpretToken(tokenType));
                }
                if (constraintDeclarationTracker.isActive()) {
                    // constraint c { x -> y; }
                    return resolveConstraintArrow(constraintDeclarationTracker.interpretToken(tokenType));
                }
                if (expectingStatement()) {
                    // -> ev;
                    return TRIGGER;
                }
                // if (a -> b) ...
                return LOGICAL_IMPLIES;
            default:
                return tokenType;
        }
    }

    // A tracker that is active but not yet inside its block leaves '->'
    // untouched; it is still an expression operator there.
    private static int resolveConstraintArrow(int tokenType) {
        return tokenType == RARROW ? LOGICAL_IMPLIES : tokenType;
    }

    // =====================================================================
    // STATE UPDATE
    // =====================================================================

    private void updateState(Token token, int tokenType) {
        keywordLabelTracker.updateState(tokenType);
        randomizeCallTracker.updateState(tokenType);
        // constraint prototypes ("extern constraint c;") have no block
        if (!inExternDeclaration) {
            constraintDeclarationTracker.updateState(tokenType);
        }

        previousTokenFinishedHeader = false;
        if (VerilogTokenClassifications.isFlowControlKeyword(tokenType)) {
            flowControl = new FlowControlState();
        }
        switch (tokenType) {
            case LPAREN:
            case LBRACE:
                balanceStack.push(token);
                break;
            case RPAREN:
                if (popBalanceIfOpenedBy(LPAREN)) {
                    // the ')' closing "if (...)", "for (...)", "case (...)"
                    if (balanceStack.isEmpty() && inFlowControlHeader()) {
                        flowControl.inBody = true;
                        previousTokenFinishedHeader = true;
                    }
                }
                break;
            case RBRACE:
                popBalanceIfOpenedBy(LBRACE);
                break;
            case KW_BEGIN:
                blockStack.push(token);
                break;
            case KW_END:
                if (!blockStack.isEmpty()) {
                    blockStack.pop();
                    // "initial begin ... end"
                    if (blockStack.isEmpty()) {
                        inInitialAlwaysFinalConstruct = false;
                    }
                }
                break;
            case SEMICOLON:
                updateOnSemicolon();
                break;
            case KW_INITIAL:
            case KW_ALWAYS:
            case KW_ALWAYS_COMB:
            case KW_ALWAYS_FF:
            case KW_ALWAYS_LATCH:
            case KW_FINAL:
                if (inModuleBody) {
                    inInitialAlwaysFinalConstruct = true;
                }
                break;
            case KW_EXTERN:
                inExternDeclaration = true;
                break;
            case KW_MODULE:
                inFunctionDeclaration = inFunctionBody = false;
                inTaskDeclaration = inTaskBody = false;
                inModuleDeclaration = true;
                inModuleBody = false;
                break;
            case KW_ENDMODULE:
                inModuleDeclaration = inModuleBody = false;
                break;
            case KW_FUNCTION:
                enterSubroutineDeclaration();
                inFunctionDeclaration = true;
                break;
            case KW_ENDFUNCTION:
                inFunctionDeclaration = inFunctionBody = false;
                resumeModuleDeclaration();
                break;
            case KW_TASK:
                enterSubroutineDeclaration();
                inTaskDeclaration = true;
                break;
            case KW_ENDTASK:
                inTaskDeclaration = inTaskBody = false;
                resumeModuleDeclaration();
                break;
            case KW_CONSTRAINT:
                inExternDeclaration = false;
                break;
            case HASH:
                if (inInitialAlwaysFinalConstruct) {
                    seenDelayValueInProceduralConstruct = true;
                }
                break;
            default:
                break;
        }
    }

    private boolean popBalanceIfOpenedBy(int openType) {
        if (!balanceStack.isEmpty() && balanceStack.peek().getType() == openType) {
            balanceStack.pop();
            return true;
        }
        return false;
    }

    private void updateOnSemicolon() {
        // The first ';' of a module, function or task declaration ends its
        // header. An extern prototype has no body, so there it ends the
        // whole declaration.
        if (inModuleDeclaration) {
            if (inExternDeclaration) {
                inModuleDeclaration = false;
                inExternDeclaration = false;
            } else {
                inModuleBody = true;
            }
            previousTokenFinishedHeader = true;
        }
        if (inFunctionDeclaration) {
            if (inExternDeclaration) {
                inFunctionDeclaration = false;
                inExternDeclaration = false;
                resumeModuleDeclaration();
            } else {
                inFunctionBody = true;
            }
            previousTokenFinishedHeader = true;
        } else if (inTaskDeclaration) {
            if (inExternDeclaration) {
                inTaskDeclaration = false;
                inExternDeclaration = false;
                resumeModuleDeclaration();
            } else {
                inTaskBody = true;
            }
            previousTokenFinishedHeader = true;
        }

        if (inInitialAlwaysFinalConstruct) {
            // single-statement bodies, e.g. "initial $foo();"
            seenDelayValueInProceduralConstruct = false;
            if (blockStack.isEmpty()) {
                inInitialAlwaysFinalConstruct = false;
            }
        }
    }

    // At most one declaration flag is set at a time. A function or task
    // inside a module body suspends the module declaration; the body flag
    // remembers where to return.
    private void enterSubroutineDeclaration() {
        inModuleDeclaration = false;
        inFunctionDeclaration = inFunctionBody = false;
        inTaskDeclaration = inTaskBody = false;
    }

    private void resumeModuleDeclaration() {
        if (inModuleBody && !inFunctionDeclaration && !inTaskDeclaration) {
            inModuleDeclaration = true;
        }
    }

    // =====================================================================
    // STATE QUERIES
    // =====================================================================

    /**
     * True where a new statement may begin, within a context that holds
     * statements (function or task body, initial/always/final construct).
     */
    public boolean expectingStatement() {
        if (inStatementContext()) {
            WithReason<Boolean> state = expectingBodyItemStart();
            LOG.trace("expectingStatement: {}", state);
            return state.getValue();
        }
        return false;
    }

    /**
     * Heuristic for "could a body item start at the next token". Usually
     * true right after ';', end-like keywords, or the end of a header;
     * false inside headers and inside any bracketed expression.
     */
    public WithReason<Boolean> expectingBodyItemStart() {
        if (inFlowControlHeader()) return WithReason.of(false, "in flow control header");
        if (inAnyDeclarationHeader()) return WithReason.of(false, "in other declaration header");
        if (!balanceStack.isEmpty()) return WithReason.of(false, "balance stack not empty");
        if (previousToken == null) {
            return WithReason.of(true, "first token");
        }
        if (inAnyDeclaration() && previousTokenFinishedHeader) {
            return WithReason.of(true, "inside declaration, and reached end of header");
        }
        if (previousToken.getType() == SEMICOLON) {
            return WithReason.of(true, "immediately following ';'");
        }
        if (VerilogTokenClassifications.isProceduralConstructKeyword(previousToken.getType())) {
            return WithReason.of(true, "immediately following 'always/initial/final'");
        }
        if (keywordLabelTracker.itemMayStart()) {
            return WithReason.of(true, "item may start");
        }
        if (seenDelayValueInProceduralConstruct) {
            return WithReason.of(true, "seen a delay value, expecting another statement");
        }
        return WithReason.of(false, "all other cases (default)");
    }

    boolean inFlowControlHeader() {
        return flowControl != null && !flowControl.isInBody();
    }

    boolean inModuleDeclarationHeader() {
        return inModuleDeclaration && !inModuleBody;
    }

    boolean inFunctionDeclarationHeader() {
        return inFunctionDeclaration && !inFunctionBody;
    }

    boolean inTaskDeclarationHeader() {
        return inTaskDeclaration && !inTaskBody;
    }

    boolean inAnyDeclaration() {
        return inFunctionDeclaration || inTaskDeclaration || inModuleDeclaration;
    }

    boolean inAnyDeclarationHeader() {
        return inFunctionDeclarationHeader() || inTaskDeclarationHeader() || inModuleDeclarationHeader();
    }

    boolean inStatementContext() {
        return inFunctionBody || inTaskBody || inInitialAlwaysFinalConstruct;
    }

    public boolean isInsideRandomizeCall() {
        return randomizeCallTracker.isActive();
    }

    public boolean isInsideConstraintDeclaration() {
        return constraintDeclarationTracker.isActive();
    }

    // Package-level accessors for inspection in tests
    Token getPreviousToken() { return previousToken; }
    boolean isInModuleDeclaration() { return inModuleDeclaration; }
    boolean isInModuleBody() { return inModuleBody; }
    boolean isInFunctionDeclaration() { return inFunctionDeclaration; }
    boolean isInFunctionBody() { return inFunctionBody; }
    boolean isInTaskDeclaration() { return inTaskDeclaration; }
    boolean isInTaskBody() { return inTaskBody; }
    boolean isInExternDeclaration() { return inExternDeclaration; }
    boolean isPreviousTokenFinishedHeader() { return previousTokenFinishedHeader; }
    boolean isInInitialAlwaysFinalConstruct() { return inInitialAlwaysFinalConstruct; }
    boolean isSeenDelayValueInProceduralConstruct() { return seenDelayValueInProceduralConstruct; }
    FlowControlState getFlowControl() { return flowControl; }
    int getBlockDepth() { return blockStack.size(); }
    int getBalanceDepth() { return balanceStack.size(); }
    KeywordLabelStateMachine getKeywordLabelTracker() { return keywordLabelTracker; }
    LastSemicolonStateMachine getPropertyDeclarationTracker() { return propertyDeclarationTracker; }
    LastSemicolonStateMachine getSequenceDeclarationTracker() { return sequenceDeclarationTracker; }
}
