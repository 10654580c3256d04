package search;

import automaton.AhoCorasick;

/**
 * Feeds a text into an {@link AhoCorasick} trie one symbol at a time.
 * The processor only reads the trie, but must not be used across calls that
 * add or remove words without a {@link #reset()}.
 */
public final class MatchProcessor {

    private final AhoCorasick ac;
    private int state = AhoCorasick.ROOT;
    private int matchedNode = AhoCorasick.UNDEFINED;
    private long position;

    public MatchProcessor(AhoCorasick ac) {
        this.ac = ac;
    }

    /**
     * Consumes one symbol.
     *
     * @return {@code true} if some pattern ends at this symbol
     */
    public boolean process(int symbol) {
        state = ac.traverse(state, symbol);
        position++;
        matchedNode = longestTerminalSuffix(ac, state);
        return matchedNode != AhoCorasick.UNDEFINED;
    }

    /** The longest pattern ending at the last symbol, or {@link AhoCorasick#UNDEFINED}. */
    public int matchedNode() {
        return matchedNode;
    }

    public int state() {
        return state;
    }

    /** Number of symbols consumed since the last reset. */
    public long position() {
        return position;
    }

    public void reset() {
        state = AhoCorasick.ROOT;
        matchedNode = AhoCorasick.UNDEFINED;
        position = 0L;
    }

    // First terminal node on the suffix-link chain of node, itself included.
    static int longestTerminalSuffix(AhoCorasick ac, int node) {
        int current = node;
        while (current != AhoCorasick.ROOT) {
            if (ac.isTerminal(current)) {
                return current;
            }
            current = ac.suffixLink(current);
        }
        return ac.isTerminal(AhoCorasick.ROOT) ? AhoCorasick.ROOT : AhoCorasick.UNDEFINED;
    }
}
