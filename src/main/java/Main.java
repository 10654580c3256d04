import automaton.AhoCorasick;
import automaton.AutomatonConfiguration;
import dot.AutomatonDot;
import search.AhoCorasickMatcher;
import search.Match;
import utilities.AlphabetMapper;
import utilities.AutomatonLogger;
import utilities.MemUtil;
import utilities.WordListReader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Command-line driver: loads a pattern list into an Aho-Corasick trie, scans a text
 * file for every occurrence, and optionally writes the trie as a DOT graph.
 *
 * <pre>
 *   --patterns FILE   one pattern per line (required)
 *   --text FILE       text to scan
 *   --mode chars|tokens   symbols are characters, or whitespace separated tokens
 *   --dot FILE        write the trie in Graphviz format
 *   --suffix-links    include suffix links in the DOT output
 *   --print N         print the first N matches
 *   --mem             print a JOL memory report
 * </pre>
 */
public final class Main {

    private static final int DEFAULT_PRINT = 20;

    public static void main(String[] args) throws IOException {
        CliOptions options = CliOptions.parse(args);

        List<String> patterns = WordListReader.readAll(options.patternsFile);
        AutomatonLogger.info(String.format(Locale.ROOT, "Patterns: %s (%d lines)  Mode: %s",
                options.patternsFile, patterns.size(), options.tokenMode ? "tokens" : "chars"));

        AhoCorasick ac = new AhoCorasick(AutomatonConfiguration.builder()
                .initialCapacity(Math.max(16, patterns.size() * 4))
                .collectStats(true)
                .build());
        AhoCorasickMatcher matcher = new AhoCorasickMatcher(ac);
        AlphabetMapper<String> tokens = new AlphabetMapper<>(1 << 10);

        long startNs = System.nanoTime();
        for (String p : patterns) {
            matcher.addPattern(options.tokenMode ? tokens.getIds(split(p)) : AhoCorasick.toSymbols(p));
        }
        ac.resolveAllSuffixLinks();
        double buildMs = (System.nanoTime() - startNs) / 1_000_000.0;
        AutomatonLogger.info(String.format(Locale.ROOT, "Built trie: %s, %d distinct patterns in %.3f ms",
                ac, matcher.numberOfPatterns(), buildMs));

        if (options.textFile != null) {
            String text = Files.readString(options.textFile, StandardCharsets.UTF_8);
            List<String> textTokens = options.tokenMode ? split(text) : null;
            int[] symbols = options.tokenMode ? tokens.lookupAll(textTokens) : AhoCorasick.toSymbols(text);

            startNs = System.nanoTime();
            List<Match> matches = matcher.report(symbols);
            double scanMs = (System.nanoTime() - startNs) / 1_000_000.0;
            System.out.printf(Locale.ROOT, "Text: %s  symbols: %d  matches: %d  scan: %.3f ms%n",
                    options.textFile, symbols.length, matches.size(), scanMs);

            int shown = Math.min(options.print, matches.size());
            for (int i = 0; i < shown; i++) {
                Match m = matches.get(i);
                String found = options.tokenMode
                        ? String.join(" ", textTokens.subList(m.start(), m.end()))
                        : text.substring(m.start(), m.end());
                System.out.printf(Locale.ROOT, "  [%d, %d) %s%n", m.start(), m.end(), found);
            }
        }

        if (options.dotFile != null) {
            AutomatonDot.dot(ac, options.suffixLinks).write(options.dotFile);
            AutomatonLogger.info("Wrote " + options.dotFile);
        }

        if (options.memReport) {
            System.out.println(new MemUtil().jolMemoryReport(true, ac));
        }
        AutomatonLogger.info("Stats: " + ac.stats());
    }

    private static List<String> split(String s) {
        String stripped = s.strip();
        if (stripped.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(stripped.split("\\s+"));
    }

    private static final class CliOptions {
        final Path patternsFile;
        final Path textFile;
        final Path dotFile;
        final boolean tokenMode;
        final boolean suffixLinks;
        final boolean memReport;
        final int print;

        private CliOptions(Path patternsFile,
                           Path textFile,
                           Path dotFile,
                           boolean tokenMode,
                           boolean suffixLinks,
                           boolean memReport,
                           int print) {
            this.patternsFile = patternsFile;
            this.textFile = textFile;
            this.dotFile = dotFile;
            this.tokenMode = tokenMode;
            this.suffixLinks = suffixLinks;
            this.memReport = memReport;
            this.print = print;
        }

        static CliOptions parse(String[] args) {
            Path patterns = null;
            Path text = null;
            Path dot = null;
            boolean tokenMode = false;
            boolean suffixLinks = false;
            boolean mem = false;
            int print = DEFAULT_PRINT;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    continue;
                }
                String key;
                String value;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    key = arg.substring(2);
                    value = null;
                }
                switch (key) {
                    case "suffix-links" -> suffixLinks = true;
                    case "mem" -> mem = true;
                    default -> {
                        if (value == null) {
                            if (i + 1 >= args.length) {
                                throw new IllegalArgumentException("Missing value for option --" + key);
                            }
                            value = args[++i];
                        }
                        switch (key) {
                            case "patterns" -> patterns = Path.of(value);
                            case "text" -> text = Path.of(value);
                            case "dot" -> dot = Path.of(value);
                            case "print" -> print = Integer.parseInt(value);
                            case "mode" -> tokenMode = parseMode(value);
                            default -> throw new IllegalArgumentException("Unknown option --" + key);
                        }
                    }
                }
            }
            if (patterns == null) {
                throw new IllegalArgumentException("--patterns is required");
            }
            return new CliOptions(patterns, text, dot, tokenMode, suffixLinks, mem, print);
        }

        private static boolean parseMode(String value) {
            switch (value) {
                case "chars":
                    return false;
                case "tokens":
                    return true;
                default:
                    throw new IllegalArgumentException("--mode must be chars or tokens, got " + value);
            }
        }
    }
}
