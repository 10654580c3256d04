package search;

import automaton.AhoCorasick;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Multi-pattern matcher over an {@link AhoCorasick} trie. Patterns may be added and
 * removed between searches; suffix links are rebuilt lazily by the trie.
 */
public final class AhoCorasickMatcher implements PatternMatcher {

    private final AhoCorasick ac;

    public AhoCorasickMatcher() {
        this(new AhoCorasick());
    }

    public AhoCorasickMatcher(AhoCorasick ac) {
        this.ac = Objects.requireNonNull(ac, "ac");
    }

    public AhoCorasick automaton() {
        return ac;
    }

    @Override
    public boolean addPattern(int[] pattern) {
        int before = ac.numberOfWords();
        ac.addWord(pattern);
        return ac.numberOfWords() != before;
    }

    public boolean addPattern(CharSequence pattern) {
        return addPattern(AhoCorasick.toSymbols(pattern));
    }

    @Override
    public boolean removePattern(int[] pattern) {
        int before = ac.numberOfWords();
        ac.rmWord(pattern);
        return ac.numberOfWords() != before;
    }

    public boolean removePattern(CharSequence pattern) {
        return removePattern(AhoCorasick.toSymbols(pattern));
    }

    @Override
    public boolean containsPattern(int[] pattern) {
        Objects.requireNonNull(pattern, "pattern");
        int current = AhoCorasick.ROOT;
        for (int letter : pattern) {
            current = ac.child(current, letter);
            if (current == AhoCorasick.UNDEFINED) {
                return false;
            }
        }
        return ac.isTerminal(current);
    }

    public boolean containsPattern(CharSequence pattern) {
        return containsPattern(AhoCorasick.toSymbols(pattern));
    }

    /**
     * Reports every occurrence, including patterns that are suffixes of longer
     * matches. Occurrences ending at the same position are listed longest first.
     * The empty pattern, if added, is not reported.
     */
    @Override
    public List<Match> report(int[] text) {
        Objects.requireNonNull(text, "text");
        List<Match> matches = new ArrayList<>();
        int state = AhoCorasick.ROOT;
        for (int i = 0; i < text.length; i++) {
            state = ac.traverse(state, text[i]);
            int current = state;
            while (current != AhoCorasick.ROOT) {
                if (ac.isTerminal(current)) {
                    int length = ac.height(current);
                    matches.add(new Match(i + 1 - length, i + 1, current));
                }
                current = ac.suffixLink(current);
            }
        }
        return matches;
    }

    public List<Match> report(CharSequence text) {
        return report(AhoCorasick.toSymbols(text));
    }

    @Override
    public boolean containsMatch(int[] text) {
        Objects.requireNonNull(text, "text");
        MatchProcessor processor = new MatchProcessor(ac);
        for (int symbol : text) {
            if (processor.process(symbol) && processor.matchedNode() != AhoCorasick.ROOT) {
                return true;
            }
        }
        return false;
    }

    public boolean containsMatch(CharSequence text) {
        return containsMatch(AhoCorasick.toSymbols(text));
    }

    @Override
    public int numberOfPatterns() {
        return ac.numberOfWords();
    }
}
