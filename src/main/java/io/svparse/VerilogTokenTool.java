package io.svparse;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.*;

import org.antlr.v4.runtime.*;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line front end: lexes and disambiguates SystemVerilog files and
 * prints tokens, rewrites, or a JSON document per file.
 */
public class VerilogTokenTool {
    private static final Logger LOG = LoggerFactory.getLogger(VerilogTokenTool.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
        "Usage: java io.svparse.VerilogTokenTool [options] <file>...\n"
        + "  --print-tokens       print disambiguated syntax tokens\n"
        + "  --print-raw-tokens   print every token, including whitespace and comments\n"
        + "  --print-rewrites     print tokens whose category was changed\n"
        + "  --export-json        print one JSON document per file\n"
        + "  --threads N          process N files in parallel\n"
        + "  --profile            print lexing and disambiguation timings";

    private final ToolOptions options;
    private final PrintStream out;
    private final PrintStream err;

    VerilogTokenTool(ToolOptions options, PrintStream out, PrintStream err) {
        this.options = options;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        ToolOptions options;
        try {
            options = ToolOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        return new VerilogTokenTool(options, out, err).processAll();
    }

    // =====================================================================
    // FILE PROCESSING
    // =====================================================================

    /** Outcome of one file: either a result or the read failure. */
    private static class FileOutcome {
        final String fileName;
        final VerilogTokenizationResult result;
        final IOException failure;

        FileOutcome(String fileName, VerilogTokenizationResult result, IOException failure) {
            this.fileName = fileName;
            this.result = result;
            this.failure = failure;
        }
    }

    int processAll() {
        List<String> files = options.getFiles();
        List<FileOutcome> outcomes = new ArrayList<>();

        if (options.getThreads() == 1 || files.size() == 1) {
            for (String file : files) {
                outcomes.add(processFile(file));
            }
        } else {
            int threads = Math.min(options.getThreads(), files.size());
            LOG.debug("Processing {} files on {} threads", files.size(), threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                List<Future<FileOutcome>> futures = new ArrayList<>();
                for (String file : files) {
                    futures.add(executor.submit(() -> processFile(file)));
                }
                for (Future<FileOutcome> future : futures) {
                    outcomes.add(future.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                err.println("Interrupted while processing files");
                return EXIT_FAILURE;
            } catch (ExecutionException e) {
                throw new IllegalStateException("Tokenization failed", e.getCause());
            } finally {
                executor.shutdownNow();
            }
        }

        // Report in argument order regardless of completion order.
        int status = EXIT_OK;
        for (FileOutcome outcome : outcomes) {
            if (outcome.failure != null) {
                err.println("Error reading " + outcome.fileName + ": " + outcome.failure.getMessage());
                status = EXIT_FAILURE;
                continue;
            }
            report(outcome.result);
            if (outcome.result.hasLexerWarnings()) {
                status = EXIT_FAILURE;
            }
        }
        return status;
    }

    private static FileOutcome processFile(String file) {
        try {
            VerilogTokenizationResult result = VerilogTokenizer.tokenizeFile(Paths.get(file));
            return new FileOutcome(file, result, null);
        } catch (IOException e) {
            LOG.debug("Could not read {}", file, e);
            return new FileOutcome(file, null, e);
        }
    }

    // =====================================================================
    // RESULTS DISPLAY
    // =====================================================================

    private void report(VerilogTokenizationResult result) {
        if (options.isExportJson()) {
            out.println(toJson(result).toString(2));
            return;
        }

        out.println("File: " + result.getFileName());
        for (String warning : result.getLexerWarnings()) {
            err.println(result.getFileName() + ": " + warning);
        }

        if (options.isPrintRawTokens()) {
            out.println("All tokens:");
            for (Token token : result.getAllTokens()) {
                out.println("  " + formatToken(token));
            }
        }
        if (options.isPrintTokens()) {
            out.println("Syntax tokens:");
            for (Token token : result.getSyntaxTokens()) {
                out.println("  " + formatToken(token));
            }
        }
        if (options.isPrintRewrites()) {
            out.println("Rewrites: " + result.getRewrites().size());
            for (TokenRewrite rewrite : result.getRewrites()) {
                out.println("  " + rewrite);
            }
        }
        if (options.isProfile()) {
            out.println("Lexing: " + result.getLexTimeMillis() + "ms, disambiguation: "
                + result.getDisambiguationTimeMillis() + "ms");
        }
        out.printf("Tokens: %d, syntax tokens: %d, rewrites: %d, lexer warnings: %d%n",
            result.getAllTokens().size(), result.getSyntaxTokens().size(),
            result.getRewrites().size(), result.getLexerWarnings().size());
    }

    static String formatToken(Token token) {
        return String.format("(#%s @%d-%d: \"%s\")",
            VerilogTokenClassifications.symbolName(token.getType()),
            token.getStartIndex(), token.getStopIndex() + 1,
            escapeString(token.getText()));
    }

    JSONObject toJson(VerilogTokenizationResult result) {
        JSONObject json = new JSONObject();
        json.put("file", result.getFileName());

        JSONArray tokens = new JSONArray();
        for (Token token : result.getSyntaxTokens()) {
            JSONObject entry = new JSONObject();
            entry.put("type", VerilogTokenClassifications.symbolName(token.getType()));
            entry.put("text", token.getText());
            entry.put("line", token.getLine());
            entry.put("column", token.getCharPositionInLine());
            tokens.put(entry);
        }
        json.put("tokens", tokens);

        JSONArray rewrites = new JSONArray();
        for (TokenRewrite rewrite : result.getRewrites()) {
            JSONObject entry = new JSONObject();
            entry.put("line", rewrite.getLine());
            entry.put("column", rewrite.getColumn());
            entry.put("text", rewrite.getText());
            entry.put("from", VerilogTokenClassifications.symbolName(rewrite.getFromType()));
            entry.put("to", VerilogTokenClassifications.symbolName(rewrite.getToType()));
            rewrites.put(entry);
        }
        json.put("rewrites", rewrites);
        json.put("lexerWarnings", new JSONArray(result.getLexerWarnings()));

        if (options.isProfile()) {
            JSONObject timing = new JSONObject();
            timing.put("lexMillis", result.getLexTimeMillis());
            timing.put("disambiguationMillis", result.getDisambiguationTimeMillis());
            json.put("timing", timing);
        }
        return json;
    }

    private static String escapeString(String str) {
        if (str == null) return "";
        return str.replace("\\", "\\\\")
                 .replace("\"", "\\\"")
                 .replace("\n", "\\n")
                 .replace("\r", "\\r")
                 .replace("\t", "\\t");
    }
}
