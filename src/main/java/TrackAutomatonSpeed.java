import automaton.AhoCorasick;
import automaton.AutomatonConfiguration;
import datagenerators.Generator;
import search.AhoCorasickMatcher;
import utilities.AutomatonLogger;

import java.util.List;
import java.util.Locale;

/**
 * Mutation and traversal benchmark: builds a trie from generated words, scans a
 * Zipf distributed text, removes half of the words, re-adds them (exercising slot
 * reuse) and scans again.
 */
public final class TrackAutomatonSpeed {

    private static final int DEFAULT_WORDS = 100_000;
    private static final int DEFAULT_MIN_LEN = 3;
    private static final int DEFAULT_MAX_LEN = 12;
    private static final int DEFAULT_ALPHABET = 26;
    private static final int DEFAULT_TEXT_LEN = 1 << 22;
    private static final double DEFAULT_ZIPF = 1.1;
    private static final int DEFAULT_RUNS = 1;
    private static final long DEFAULT_SEED = 42L;

    public static void main(String[] args) {
        CliOptions options = CliOptions.parse(args);

        System.out.printf(Locale.ROOT,
                "Words: %d  Length: [%d, %d]  Alphabet: %d  Text: %d  Zipf: %.2f  Policy: %s  Runs: %d%n",
                options.words, options.minLength, options.maxLength, options.alphabet,
                options.textLength, options.zipf, options.policy, options.runs);

        double addMs = 0, scanMs = 0, removeMs = 0, rescanMs = 0;
        long matches = 0;
        for (int run = 0; run < options.runs; run++) {
            Generator gen = new Generator(options.seed + run);
            int[] text = gen.zipfText(options.textLength, options.alphabet, options.zipf);
            // Half the words are factors of the text so the scan finds something.
            List<int[]> words = gen.factorsOf(text, options.words / 2, options.minLength, options.maxLength);
            words.addAll(gen.uniformWords(options.words - words.size(), options.minLength, options.maxLength, options.alphabet));

            AhoCorasick ac = new AhoCorasick(AutomatonConfiguration.builder()
                    .initialCapacity(options.words * 4)
                    .recyclePolicy(options.policy)
                    .collectStats(true)
                    .build());
            AhoCorasickMatcher matcher = new AhoCorasickMatcher(ac);

            long t0 = System.nanoTime();
            for (int[] w : words) {
                ac.addWord(w);
            }
            long t1 = System.nanoTime();
            matches += matcher.report(text).size();
            long t2 = System.nanoTime();
            for (int i = 0; i < words.size(); i += 2) {
                ac.rmWord(words.get(i));
            }
            for (int i = 0; i < words.size(); i += 2) {
                ac.addWord(words.get(i));
            }
            long t3 = System.nanoTime();
            matcher.report(text);
            long t4 = System.nanoTime();

            addMs += (t1 - t0) / 1e6;
            scanMs += (t2 - t1) / 1e6;
            removeMs += (t3 - t2) / 1e6;
            rescanMs += (t4 - t3) / 1e6;
            AutomatonLogger.info("Run " + run + ": " + ac + " " + ac.stats());
        }

        int runs = Math.max(1, options.runs);
        System.out.printf(Locale.ROOT,
                "add: %.3f ms | scan: %.3f ms | rm+re-add: %.3f ms | rescan: %.3f ms | matches/run: %.0f | symbols/s: %.2f%n",
                addMs / runs, scanMs / runs, removeMs / runs, rescanMs / runs, matches / (double) runs,
                options.textLength / ((scanMs / runs) / 1000.0));
    }

    private static final class CliOptions {
        final int words;
        final int minLength;
        final int maxLength;
        final int alphabet;
        final int textLength;
        final double zipf;
        final AutomatonConfiguration.RecyclePolicy policy;
        final int runs;
        final long seed;

        private CliOptions(int words, int minLength, int maxLength, int alphabet, int textLength,
                           double zipf, AutomatonConfiguration.RecyclePolicy policy, int runs, long seed) {
            this.words = words;
            this.minLength = minLength;
            this.maxLength = maxLength;
            this.alphabet = alphabet;
            this.textLength = textLength;
            this.zipf = zipf;
            this.policy = policy;
            this.runs = runs;
            this.seed = seed;
        }

        static CliOptions parse(String[] args) {
            int words = DEFAULT_WORDS;
            int minLen = DEFAULT_MIN_LEN;
            int maxLen = DEFAULT_MAX_LEN;
            int alphabet = DEFAULT_ALPHABET;
            int textLen = DEFAULT_TEXT_LEN;
            double zipf = DEFAULT_ZIPF;
            AutomatonConfiguration.RecyclePolicy policy = AutomatonConfiguration.RecyclePolicy.LIFO;
            int runs = DEFAULT_RUNS;
            long seed = DEFAULT_SEED;

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
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for option --" + key);
                    }
                    value = args[++i];
                }
                switch (key) {
                    case "words" -> words = Integer.parseInt(value);
                    case "min-len" -> minLen = Integer.parseInt(value);
                    case "max-len" -> maxLen = Integer.parseInt(value);
                    case "alphabet" -> alphabet = Integer.parseInt(value);
                    case "text" -> textLen = Integer.parseInt(value);
                    case "zipf" -> zipf = Double.parseDouble(value);
                    case "policy" -> policy = AutomatonConfiguration.RecyclePolicy.valueOf(value.toUpperCase(Locale.ROOT));
                    case "runs" -> runs = Integer.parseInt(value);
                    case "seed" -> seed = Long.parseLong(value);
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }
            return new CliOptions(words, minLen, maxLen, alphabet, textLen, zipf, policy, runs, seed);
        }
    }
}
