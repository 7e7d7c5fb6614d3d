package io.svparse;

import java.util.*;

import org.antlr.v4.runtime.*;

// =====================================================================
// TOKENIZATION RESULTS
// =====================================================================

/**
 * One token whose type was changed by disambiguation.
 */
class TokenRewrite {
    private final int tokenIndex;
    private final int line;
    private final int column;
    private final String text;
    private final int fromType;
    private final int toType;

    TokenRewrite(Token token, int fromType) {
        this.tokenIndex = token.getTokenIndex();
        this.line = token.getLine();
        this.column = token.getCharPositionInLine();
        this.text = token.getText();
        this.fromType = fromType;
        this.toType = token.getType();
    }

    public int getTokenIndex() { return tokenIndex; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getText() { return text; }
    public int getFromType() { return fromType; }
    public int getToType() { return toType; }

    @Override
    public String toString() {
        return String.format("%d:%d '%s' %s -> %s", line, column, text,
            VerilogTokenClassifications.symbolName(fromType),
            VerilogTokenClassifications.symbolName(toType));
    }
}

/**
 * Everything known about one file after lexing and disambiguation.
 */
class VerilogTokenizationResult {
    private String fileName;
    private List<Token> allTokens = new ArrayList<>();
    private List<Token> syntaxTokens = new ArrayList<>();
    private List<TokenRewrite> rewrites = new ArrayList<>();
    private List<String> lexerWarnings = new ArrayList<>();
    private long lexTimeMillis;
    private long disambiguationTimeMillis;

    public String getFileName() { return fileName; }
    public void setFileName(String fileName) { this.fileName = fileName; }

    /** Every lexed token, including whitespace and comments. */
    public List<Token> getAllTokens() { return allTokens; }
    public void setAllTokens(List<Token> allTokens) { this.allTokens = allTokens; }

    /** The tokens a parser sees, ending with EOF. */
    public List<Token> getSyntaxTokens() { return syntaxTokens; }
    public void setSyntaxTokens(List<Token> syntaxTokens) { this.syntaxTokens = syntaxTokens; }

    public List<TokenRewrite> getRewrites() { return rewrites; }
    public void setRewrites(List<TokenRewrite> rewrites) { this.rewrites = rewrites; }

    public List<String> getLexerWarnings() { return lexerWarnings; }
    public void setLexerWarnings(List<String> lexerWarnings) { this.lexerWarnings = lexerWarnings; }

    public long getLexTimeMillis() { return lexTimeMillis; }
    public void setLexTimeMillis(long lexTimeMillis) { this.lexTimeMillis = lexTimeMillis; }

    public long getDisambiguationTimeMillis() { return disambiguationTimeMillis; }
    public void setDisambiguationTimeMillis(long disambiguationTimeMillis) {
        this.disambiguationTimeMillis = disambiguationTimeMillis;
    }

    public boolean hasLexerWarnings() {
        return !lexerWarnings.isEmpty();
    }

    /**
     * A fresh token stream over copies of the disambiguated tokens, for a
     * parser. Buffering re-numbers token indexes, so the originals are not
     * handed out.
     */
    public TokenStream newParserTokenStream() {
        List<Token> copies = new ArrayList<>(syntaxTokens.size());
        for (Token token : syntaxTokens) {
            copies.add(new CommonToken(token));
        }
        return new CommonTokenStream(new ListTokenSource(copies, fileName));
    }

    public int countTokensOfType(int tokenType) {
        int count = 0;
        for (Token token : syntaxTokens) {
            if (token.getType() == tokenType) count++;
        }
        return count;
    }

    @Override
    public String toString() {
        return String.format("VerilogTokenizationResult{file='%s', tokens=%d, rewrites=%d, warnings=%d}",
            fileName, syntaxTokens.size(), rewrites.size(), lexerWarnings.size());
    }
}
