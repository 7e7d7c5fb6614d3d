package io.svparse;

import java.util.*;

/**
 * Command-line options for {@link VerilogTokenTool}. Immutable once parsed.
 */
final class ToolOptions {
    private final boolean printTokens;
    private final boolean printRawTokens;
    private final boolean printRewrites;
    private final boolean exportJson;
    private final boolean profile;
    private final int threads;
    private final List<String> files;

    private ToolOptions(boolean printTokens, boolean printRawTokens, boolean printRewrites,
                        boolean exportJson, boolean profile, int threads, List<String> files) {
        this.printTokens = printTokens;
        this.printRawTokens = printRawTokens;
        this.printRewrites = printRewrites;
        this.exportJson = exportJson;
        this.profile = profile;
        this.threads = threads;
        this.files = Collections.unmodifiableList(new ArrayList<>(files));
    }

    /**
     * @throws IllegalArgumentException on an unknown option, a bad thread
     *         count, or when no file is named
     */
    static ToolOptions parse(String[] args) {
        boolean printTokens = false;
        boolean printRawTokens = false;
        boolean printRewrites = false;
        boolean exportJson = false;
        boolean profile = false;
        int threads = 1;
        List<String> files = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--print-tokens":
                    printTokens = true;
                    break;
                case "--print-raw-tokens":
                    printRawTokens = true;
                    break;
                case "--print-rewrites":
                    printRewrites = true;
                    break;
                case "--export-json":
                    exportJson = true;
                    break;
                case "--profile":
                    profile = true;
                    break;
                case "--threads":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--threads requires a value");
                    }
                    threads = parseThreadCount(args[++i]);
                    break;
                default:
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    files.add(arg);
            }
        }

        if (files.isEmpty()) {
            throw new IllegalArgumentException("No input files");
        }
        return new ToolOptions(printTokens, printRawTokens, printRewrites,
            exportJson, profile, threads, files);
    }

    private static int parseThreadCount(String value) {
        int count;
        try {
            count = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--threads expects a positive integer, got: " + value, e);
        }
        if (count < 1) {
            throw new IllegalArgumentException("--threads expects a positive integer, got: " + value);
        }
        return count;
    }

    boolean isPrintTokens() { return printTokens; }
    boolean isPrintRawTokens() { return printRawTokens; }
    boolean isPrintRewrites() { return printRewrites; }
    boolean isExportJson() { return exportJson; }
    boolean isProfile() { return profile; }
    int getThreads() { return threads; }
    List<String> getFiles() { return files; }
}
