package search;

/**
 * One occurrence of a pattern: the text range {@code [start, end)} and the trie
 * node whose signature is the matched pattern.
 */
public record Match(int start, int end, int node) {

    public int length() {
        return end - start;
    }
}
