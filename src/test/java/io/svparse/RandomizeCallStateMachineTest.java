package io.svparse;

import org.junit.jupiter.api.Test;

import static io.svparse.SystemVerilogLexer.*;
import static org.junit.jupiter.api.Assertions.*;

class RandomizeCallStateMachineTest {

    private final RandomizeCallStateMachine machine = new RandomizeCallStateMachine();

    private VerilogTestTokens.Stepper tokenize(String code) {
        return new VerilogTestTokens.Stepper(code, machine::interpretToken, machine::updateState);
    }

    @Test
    void activatedByRandomizeKeyword() {
        assertFalse(machine.isActive());
        machine.updateState(KW_RANDOMIZE);
        assertTrue(machine.isActive());
        assertEquals(RandomizeCallStateMachine.State.GOT_RANDOMIZE_KEYWORD, machine.getState());
    }

    @Test
    void scopedCall() {
        VerilogTestTokens.Stepper tokens = tokenize("x = std::randomize;");
        tokens.expect(SIMPLE_IDENTIFIER, ASSIGN, SIMPLE_IDENTIFIER, SCOPE, KW_RANDOMIZE);
        assertTrue(machine.isActive());
        tokens.expect(SEMICOLON);
        assertFalse(machine.isActive());
    }

    @Test
    void methodCall() {
        VerilogTestTokens.Stepper tokens = tokenize("x = y.randomize;");
        tokens.expect(SIMPLE_IDENTIFIER, ASSIGN, SIMPLE_IDENTIFIER, DOT, KW_RANDOMIZE);
        assertTrue(machine.isActive());
        tokens.expect(SEMICOLON);
        assertFalse(machine.isActive());
    }

    @Test
    void methodCallEmptyVariables() {
        VerilogTestTokens.Stepper tokens = tokenize("x = y.randomize();");
        tokens.expect(SIMPLE_IDENTIFIER, ASSIGN, SIMPLE_IDENTIFIER, DOT, KW_RANDOMIZE, LPAREN, RPAREN);
        assertEquals(RandomizeCallStateMachine.State.CLOSED_VARIABLE_LIST, machine.getState());
        tokens.expect(SEMICOLON);
        assertFalse(machine.isActive());
    }

    @Test
    void methodCallVariables() {
        VerilogTestTokens.Stepper tokens = tokenize("x = y.randomize(z, w);");
        tokens.expect(SIMPLE_IDENTIFIER, ASSIGN, SIMPLE_IDENTIFIER, DOT, KW_RANDOMIZE, LPAREN,
            SIMPLE_IDENTIFIER, COMMA, SIMPLE_IDENTIFIER);
        assertEquals(RandomizeCallStateMachine.State.OPENED_VARIABLE_LIST, machine.getState());
        tokens.expect(RPAREN);
        assertTrue(machine.isActive());
        tokens.expect(SEMICOLON);
        assertFalse(machine.isActive());
    }

    @Test
    void callAsPredicate() {
        VerilogTestTokens.Stepper tokens = tokenize("if (y.randomize) begin");
        tokens.expect(KW_IF, LPAREN, SIMPLE_IDENTIFIER, DOT, KW_RANDOMIZE);
        assertTrue(machine.isActive());
        tokens.expect(RPAREN);
        assertFalse(machine.isActive());
        tokens.expect(KW_BEGIN);
        assertFalse(machine.isActive());
    }

    @Test
    void withConstraintBlock() {
        VerilogTestTokens.Stepper tokens = tokenize("if (y.randomize with {a -> b;}) begin");
        tokens.expect(KW_IF, LPAREN, SIMPLE_IDENTIFIER, DOT, KW_RANDOMIZE);
        assertTrue(machine.isActive());
        tokens.expect(KW_WITH, LBRACE);
        assertEquals(RandomizeCallStateMachine.State.INSIDE_CONSTRAINT_BLOCK, machine.getState());
        tokens.expect(SIMPLE_IDENTIFIER, CONSTRAINT_IMPLIES, SIMPLE_IDENTIFIER, SEMICOLON, RBRACE);
        assertFalse(machine.isActive());
        tokens.expect(RPAREN, KW_BEGIN);
        assertFalse(machine.isActive());
    }

    @Test
    void withEmptyIdentifierListAndConstraintBlock() {
        VerilogTestTokens.Stepper tokens = tokenize("if (y.randomize with () {a -> b;}) begin");
        tokens.expect(KW_IF, LPAREN, SIMPLE_IDENTIFIER, DOT, KW_RANDOMIZE);
        tokens.expect(KW_WITH, LPAREN, RPAREN);
        assertEquals(RandomizeCallStateMachine.State.EXPECT_CONSTRAINT_BLOCK, machine.getState());
        tokens.expect(LBRACE, SIMPLE_IDENTIFIER, CONSTRAINT_IMPLIES, SIMPLE_IDENTIFIER, SEMICOLON, RBRACE);
        assertFalse(machine.isActive());
        tokens.expect(RPAREN, KW_BEGIN);
        assertFalse(machine.isActive());
    }

    @Test
    void withIdentifierListAndConstraintBlock() {
        VerilogTestTokens.Stepper tokens = tokenize("if (y.randomize with (j, k) {a -> b;}) begin");
        tokens.expect(KW_IF, LPAREN, SIMPLE_IDENTIFIER, DOT, KW_RANDOMIZE);
        assertTrue(machine.isActive());
        tokens.expect(KW_WITH, LPAREN, SIMPLE_IDENTIFIER, COMMA, SIMPLE_IDENTIFIER, RPAREN, LBRACE,
            SIMPLE_IDENTIFIER, CONSTRAINT_IMPLIES, SIMPLE_IDENTIFIER, SEMICOLON, RBRACE);
        assertFalse(machine.isActive());
        tokens.expect(RPAREN, KW_BEGIN);
        assertFalse(machine.isActive());
    }

    @Test
    void variableListThenWithBlock() {
        VerilogTestTokens.Stepper tokens = tokenize("ok = obj.randomize(x) with { if (m) x -> y; };");
        tokens.expect(SIMPLE_IDENTIFIER, ASSIGN, SIMPLE_IDENTIFIER, DOT, KW_RANDOMIZE,
            LPAREN, SIMPLE_IDENTIFIER, RPAREN, KW_WITH, LBRACE,
            KW_IF, LPAREN, SIMPLE_IDENTIFIER, RPAREN,
            SIMPLE_IDENTIFIER, CONSTRAINT_IMPLIES, SIMPLE_IDENTIFIER, SEMICOLON, RBRACE);
        assertFalse(machine.isActive());
        tokens.expect(SEMICOLON);
        assertFalse(machine.isActive());
    }

    @Test
    void withFollowedByNonBlockTokenResets() {
        VerilogTestTokens.Stepper tokens = tokenize("x = randomize() with; -> e;");
        tokens.expect(SIMPLE_IDENTIFIER, ASSIGN, KW_RANDOMIZE, LPAREN, RPAREN, KW_WITH);
        assertEquals(RandomizeCallStateMachine.State.GOT_WITH_KEYWORD, machine.getState());
        tokens.expect(SEMICOLON);
        assertFalse(machine.isActive());
        // left untouched once the tracker is idle again
        tokens.expect(RARROW, SIMPLE_IDENTIFIER, SEMICOLON);
        assertFalse(machine.isActive());
    }

    @Test
    void truncatedCallStaysOpenWithoutFailing() {
        VerilogTestTokens.Stepper tokens = tokenize("x = y.randomize(");
        tokens.expect(SIMPLE_IDENTIFIER, ASSIGN, SIMPLE_IDENTIFIER, DOT, KW_RANDOMIZE, LPAREN, EOF);
        assertEquals(RandomizeCallStateMachine.State.OPENED_VARIABLE_LIST, machine.getState());
    }
}
