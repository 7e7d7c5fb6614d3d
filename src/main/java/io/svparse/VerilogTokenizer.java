package io.svparse;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

import org.antlr.v4.runtime.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lexes one SystemVerilog source, filters out whitespace and comments, and
 * runs a fresh {@link VerilogLexicalContext} over what remains. Lexer
 * problems are collected as warnings, never thrown.
 *
 * <p>Instances are single-use and not shared between threads; tokenize
 * several files concurrently by giving each its own tokenizer. The
 * pipeline and its result types are package-private.
 */
class VerilogTokenizer {
    private static final Logger LOG = LoggerFactory.getLogger(VerilogTokenizer.class);

    // Log only the first few lexer errors per file to avoid spam
    private static final int MAX_LOGGED_LEXER_ERRORS = 5;

    private final String fileName;
    private final List<String> lexerWarnings = new ArrayList<>();

    VerilogTokenizer(String fileName) {
        this.fileName = fileName;
    }

    static VerilogTokenizationResult tokenizeFile(Path path) throws IOException {
        String source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        return new VerilogTokenizer(path.toString()).tokenize(source);
    }

    VerilogTokenizationResult tokenize(String source) {
        long startTime = System.currentTimeMillis();

        CharStream input = CharStreams.fromString(source, fileName);
        SystemVerilogLexer lexer = new SystemVerilogLexer(input);
        setupErrorHandling(lexer);

        CommonTokenStream tokenStream = new CommonTokenStream(lexer);
        tokenStream.fill();

        List<Token> allTokens = new ArrayList<>(tokenStream.getTokens());
        List<WritableToken> syntaxTokens = filterTokensForSyntaxTree(allTokens);
        long lexTime = System.currentTimeMillis() - startTime;

        int[] rawTypes = new int[syntaxTokens.size()];
        for (int i = 0; i < rawTypes.length; i++) {
            rawTypes[i] = syntaxTokens.get(i).getType();
        }

        startTime = System.currentTimeMillis();
        new VerilogLexicalContext().transformVerilogSymbols(syntaxTokens);
        long disambiguationTime = System.currentTimeMillis() - startTime;

        // Compare afterwards: some rewrites land on tokens already passed.
        List<TokenRewrite> rewrites = new ArrayList<>();
        for (int i = 0; i < rawTypes.length; i++) {
            WritableToken token = syntaxTokens.get(i);
            if (token.getType() != rawTypes[i]) {
                rewrites.add(new TokenRewrite(token, rawTypes[i]));
            }
        }
        LOG.debug("{}: {} tokens, {} syntax tokens, {} rewritten",
            fileName, allTokens.size(), syntaxTokens.size(), rewrites.size());

        VerilogTokenizationResult result = new VerilogTokenizationResult();
        result.setFileName(fileName);
        result.setAllTokens(allTokens);
        result.setSyntaxTokens(new ArrayList<>(syntaxTokens));
        result.setRewrites(rewrites);
        result.setLexerWarnings(new ArrayList<>(lexerWarnings));
        result.setLexTimeMillis(lexTime);
        result.setDisambiguationTimeMillis(disambiguationTime);
        return result;
    }

    /** Keeps default-channel tokens, which always includes the final EOF. */
    static List<WritableToken> filterTokensForSyntaxTree(List<Token> tokens) {
        List<WritableToken> filtered = new ArrayList<>();
        for (Token token : tokens) {
            if (token.getChannel() == Token.DEFAULT_CHANNEL) {
                filtered.add((WritableToken) token);
            }
        }
        return filtered;
    }

    // =====================================================================
    // ERROR HANDLING SETUP
    // =====================================================================

    private void setupErrorHandling(SystemVerilogLexer lexer) {
        lexer.removeErrorListeners();
        lexer.addErrorListener(new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                    int line, int charPositionInLine, String msg, RecognitionException e) {
                String error = "Lexer error at line " + line + ":" + charPositionInLine + " - " + msg;
                lexerWarnings.add(error);
                if (lexerWarnings.size() <= MAX_LOGGED_LEXER_ERRORS) {
                    LOG.warn("{}: {}", fileName, error);
                }
            }
        });
    }

    public String getFileName() { return fileName; }
}
