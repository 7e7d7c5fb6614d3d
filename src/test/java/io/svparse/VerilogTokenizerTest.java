package io.svparse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

import org.antlr.v4.runtime.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class VerilogTokenizerTest {

    private static final String EVENT_MODULE =
        "module m;\n"
        + "  // comment\n"
        + "  initial -> ev;\n"
        + "  assign q = a -> b;\n"
        + "endmodule\n";

    @Test
    void recordsImmediateRewrites() {
        VerilogTokenizationResult result = new VerilogTokenizer("m.sv").tokenize(EVENT_MODULE);

        assertEquals("m.sv", result.getFileName());
        assertFalse(result.hasLexerWarnings());
        assertEquals(2, result.getRewrites().size());

        TokenRewrite trigger = result.getRewrites().get(0);
        assertEquals(3, trigger.getLine());
        assertEquals(10, trigger.getColumn());
        assertEquals("->", trigger.getText());
        assertEquals(SystemVerilogLexer.RARROW, trigger.getFromType());
        assertEquals(SystemVerilogLexer.TRIGGER, trigger.getToType());
        assertEquals("3:10 '->' RARROW -> TRIGGER", trigger.toString());

        assertEquals(SystemVerilogLexer.LOGICAL_IMPLIES, result.getRewrites().get(1).getToType());
    }

    @Test
    void recordsRetroactiveSemicolonRewrite() {
        VerilogTokenizationResult result = new VerilogTokenizer("p.sv")
            .tokenize("property p; int v; a |-> b; endproperty");

        assertEquals(1, result.getRewrites().size());
        TokenRewrite rewrite = result.getRewrites().get(0);
        assertEquals(";", rewrite.getText());
        assertEquals(SystemVerilogLexer.SEMICOLON, rewrite.getFromType());
        assertEquals(SystemVerilogLexer.SEMICOLON_END_OF_ASSERTION_VARIABLE_DECLARATIONS,
            rewrite.getToType());
        assertEquals(1, result.countTokensOfType(
            SystemVerilogLexer.SEMICOLON_END_OF_ASSERTION_VARIABLE_DECLARATIONS));
    }

    @Test
    void syntaxTokensExcludeHiddenChannelAndEndWithEof() {
        VerilogTokenizationResult result = new VerilogTokenizer("m.sv").tokenize(EVENT_MODULE);

        List<Token> syntax = result.getSyntaxTokens();
        assertEquals(Token.EOF, syntax.get(syntax.size() - 1).getType());
        for (Token token : syntax) {
            assertEquals(Token.DEFAULT_CHANNEL, token.getChannel());
        }
        assertTrue(result.getAllTokens().size() > syntax.size());
        assertTrue(result.getAllTokens().stream()
            .anyMatch(t -> t.getType() == SystemVerilogLexer.LINE_COMMENT));
        assertEquals(0, result.countTokensOfType(SystemVerilogLexer.RARROW));
    }

    @Test
    void collectsLexerErrorsAsWarnings() {
        VerilogTokenizationResult result = new VerilogTokenizer("bad.sv").tokenize("module m; ` endmodule");

        assertTrue(result.hasLexerWarnings());
        assertEquals(1, result.getLexerWarnings().size());
        assertTrue(result.getLexerWarnings().get(0).startsWith("Lexer error at line 1:10"),
            result.getLexerWarnings().get(0));
        // scanning continues past the bad character
        assertEquals(SystemVerilogLexer.KW_ENDMODULE,
            result.getSyntaxTokens().get(result.getSyntaxTokens().size() - 2).getType());
    }

    @Test
    void parserTokenStreamCarriesRewrittenTypes() {
        VerilogTokenizationResult result = new VerilogTokenizer("m.sv").tokenize(EVENT_MODULE);

        CommonTokenStream stream = (CommonTokenStream) result.newParserTokenStream();
        stream.fill();
        List<Token> parserTokens = stream.getTokens();

        assertEquals(result.getSyntaxTokens().size(), parserTokens.size());
        for (int i = 0; i < parserTokens.size(); i++) {
            assertEquals(result.getSyntaxTokens().get(i).getType(), parserTokens.get(i).getType());
            assertEquals(result.getSyntaxTokens().get(i).getText(), parserTokens.get(i).getText());
        }
        assertEquals("m.sv", stream.getSourceName());
    }

    @Test
    void tokenizesFileFromDisk(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("top.sv");
        Files.write(file, EVENT_MODULE.getBytes(StandardCharsets.UTF_8));

        VerilogTokenizationResult result = VerilogTokenizer.tokenizeFile(file);

        assertEquals(file.toString(), result.getFileName());
        assertEquals(1, result.countTokensOfType(SystemVerilogLexer.TRIGGER));
    }

    @Test
    void missingFileThrows(@TempDir Path dir) {
        assertThrows(IOException.class, () -> VerilogTokenizer.tokenizeFile(dir.resolve("absent.sv")));
    }
}
