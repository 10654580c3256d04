package automaton;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntMaps;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import utilities.AutomatonLogger;

import java.util.Objects;

/**
 * A trie over words of non-negative integer symbols, augmented with suffix links,
 * for use with the Aho-Corasick dictionary matching algorithm.
 *
 * <p>Nodes are addressed by {@code int} indices into an arena. A node is
 * <em>active</em> while it is part of the trie and <em>inactive</em> once it has
 * been removed; inactive slots are reused by later insertions. An index handed out
 * by this class stays meaningful only until the next call that adds or removes a
 * word, so callers holding on to an index should revalidate it with
 * {@link #validateActiveNodeIndex(int)}.
 *
 * <p>Suffix links are computed lazily. Adding or removing nodes invalidates all
 * cached links, and each link is recomputed the first time it is needed afterwards.
 * Because of this even {@link #traverse(int, int)} writes to the structure, so an
 * instance must not be shared between threads without a single external lock.
 */
public final class AhoCorasick {

    /** Returned where no node exists, and used as the parent of the root. */
    public static final int UNDEFINED = -1;

    /** Index of the root node, whose signature is the empty word. */
    public static final int ROOT = 0;

    private final AutomatonConfiguration config;
    private final AutomatonStats stats;
    private final NodeArena arena;
    private final NodeValidator validator;
    private final SuffixLinkResolver links;
    private int numberOfWords;

    /** Constructs a trie containing only the root. */
    public AhoCorasick() {
        this(AutomatonConfiguration.defaults());
    }

    public AhoCorasick(AutomatonConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
        this.stats = new AutomatonStats(config.collectStats());
        this.arena = new NodeArena(config.initialCapacity(),
                config.expectedAlphabetSize(),
                config.recyclePolicy(),
                stats);
        this.validator = new NodeValidator(arena);
        this.links = new SuffixLinkResolver(arena, stats);
    }

    /** Deep copy; the two instances share no state afterwards. */
    public AhoCorasick(AhoCorasick that) {
        Objects.requireNonNull(that, "that");
        this.config = that.config;
        this.stats = new AutomatonStats(that.stats);
        this.arena = new NodeArena(that.arena, stats);
        this.validator = new NodeValidator(arena);
        this.links = new SuffixLinkResolver(that.links, arena, stats);
        this.numberOfWords = that.numberOfWords;
    }

    /**
     * Puts this object back into the state of a newly constructed one.
     *
     * @return {@code this}
     */
    public AhoCorasick init() {
        int dropped = arena.size();
        arena.reset();
        links.invalidate();
        numberOfWords = 0;
        AutomatonLogger.debug("reinitialised trie, dropped " + dropped + " node slots");
        return this;
    }

    // ------------------------------------------------------------------
    // Trie mutation
    // ------------------------------------------------------------------

    /**
     * Adds {@code word} to the trie and makes its final node terminal.
     * Adding a word that is already present changes nothing. Creating any
     * node invalidates every cached suffix link.
     *
     * @return the index of the node whose signature equals {@code word}
     * @throws IllegalArgumentException if {@code word} contains a negative symbol
     */
    public int addWord(int[] word) {
        Objects.requireNonNull(word, "word");
        checkSymbols(word);
        int current = ROOT;
        boolean created = false;
        for (int i = 0; i < word.length; i++) {
            Node node = arena.node(current);
            int next = node.child(word[i]);
            if (next == UNDEFINED) {
                next = arena.allocate(current, word[i], i + 1);
                node.children.put(word[i], next);
                created = true;
            }
            current = next;
        }
        if (created) {
            links.invalidate();
        }
        Node last = arena.node(current);
        if (!last.terminal) {
            last.terminal = true;
            numberOfWords++;
            stats.recordWordAdded();
        }
        return current;
    }

    /** Adds the word whose symbols are the {@code char} values of {@code word}. */
    public int addWord(CharSequence word) {
        return addWord(toSymbols(word));
    }

    public int addWord(IntList word) {
        return addWord(Objects.requireNonNull(word, "word").toIntArray());
    }

    /**
     * Removes {@code word} from the trie.
     *
     * <p>If the node for {@code word} is terminal and has children, it just stops
     * being terminal. If it is terminal and has no children, it is freed together
     * with every ancestor that is neither terminal, the root, nor the parent of
     * another remaining node; all cached suffix links become invalid. If there is
     * no terminal node for {@code word}, nothing happens.
     *
     * @return the index of the node whose signature equals {@code word}, which may
     *         now be inactive, or {@link #UNDEFINED} if the trie has no such node
     */
    public int rmWord(int[] word) {
        Objects.requireNonNull(word, "word");
        int last = ROOT;
        for (int letter : word) {
            last = arena.node(last).child(letter);
            if (last == UNDEFINED) {
                return UNDEFINED;
            }
        }
        Node node = arena.node(last);
        if (!node.terminal) {
            return last;
        }
        numberOfWords--;
        stats.recordWordRemoved();
        if (last == ROOT || node.numberOfChildren() > 0) {
            node.terminal = false;
            return last;
        }

        int current = last;
        int parent = node.parent;
        int letter = node.parentLetter;
        int freed = 1;
        arena.free(current);
        while (parent != ROOT) {
            Node p = arena.node(parent);
            if (p.terminal || p.numberOfChildren() > 1) {
                break;
            }
            current = parent;
            letter = p.parentLetter;
            parent = p.parent;
            arena.free(current);
            freed++;
        }
        arena.node(parent).children.remove(letter);
        links.invalidate();
        if (AutomatonLogger.isDebugEnabled()) {
            AutomatonLogger.debug("removed word of length " + word.length + ", freed " + freed + " nodes");
        }
        return last;
    }

    public int rmWord(CharSequence word) {
        return rmWord(toSymbols(word));
    }

    public int rmWord(IntList word) {
        return rmWord(Objects.requireNonNull(word, "word").toIntArray());
    }

    // ------------------------------------------------------------------
    // Traversal
    // ------------------------------------------------------------------

    /**
     * Traverses the trie from {@code current} by {@code letter}, following suffix
     * links where necessary. This combines the goto and fail functions of
     * Aho and Corasick: if {@code current} has signature {@code W}, the result is
     * the node whose signature is the longest suffix of {@code Wa} in the trie.
     *
     * @throws NodeIndexException if {@code current} is not an active node
     */
    public int traverse(int current, int letter) {
        validator.validateActiveNodeIndex(current);
        return links.traverse(current, letter);
    }

    /** Folds {@link #traverse(int, int)} over {@code word}, starting at {@code start}. */
    public int traverseWord(int start, int[] word) {
        Objects.requireNonNull(word, "word");
        validator.validateActiveNodeIndex(start);
        int current = start;
        for (int letter : word) {
            current = links.traverse(current, letter);
        }
        return current;
    }

    public int traverseWord(int[] word) {
        return traverseWord(ROOT, word);
    }

    public int traverseWord(int start, CharSequence word) {
        return traverseWord(start, toSymbols(word));
    }

    public int traverseWord(CharSequence word) {
        return traverseWord(ROOT, toSymbols(word));
    }

    /**
     * Returns the child of {@code parent} along the edge labelled {@code letter},
     * or {@link #UNDEFINED} if there is none. Suffix links are not followed.
     */
    public int child(int parent, int letter) {
        validator.validateActiveNodeIndex(parent);
        return arena.node(parent).child(letter);
    }

    /**
     * Returns the index of the node whose signature is the longest proper suffix
     * of the signature of {@code current} contained in the trie. The root links
     * to itself.
     *
     * @throws NodeIndexException if {@code current} is not an active node
     */
    public int suffixLink(int current) {
        validator.validateActiveNodeIndex(current);
        return links.suffixLink(current);
    }

    /** Computes every suffix link that is not already current, breadth first. */
    public void resolveAllSuffixLinks() {
        links.resolveAll();
    }

    /** Whether the cached suffix link of {@code i} is usable without recomputation. */
    public boolean hasCurrentSuffixLink(int i) {
        validator.validateActiveNodeIndex(i);
        return i == ROOT || links.isCurrent(i);
    }

    // ------------------------------------------------------------------
    // Node queries
    // ------------------------------------------------------------------

    /** Edge labels of the path from the root to {@code i}; linear in the height. */
    public int[] signature(int i) {
        validator.validateActiveNodeIndex(i);
        int[] word = new int[arena.node(i).height];
        int current = i;
        for (int k = word.length - 1; k >= 0; k--) {
            Node node = arena.node(current);
            word[k] = node.parentLetter;
            current = node.parent;
        }
        return word;
    }

    public IntList signatureList(int i) {
        return IntArrayList.wrap(signature(i));
    }

    /** Length of the signature of {@code i}. */
    public int height(int i) {
        validator.validateActiveNodeIndex(i);
        return arena.node(i).height;
    }

    public int parent(int i) {
        validator.validateActiveNodeIndex(i);
        return arena.node(i).parent;
    }

    public int parentLetter(int i) {
        validator.validateActiveNodeIndex(i);
        return arena.node(i).parentLetter;
    }

    public boolean isTerminal(int i) {
        validator.validateActiveNodeIndex(i);
        return arena.node(i).terminal;
    }

    /** Read-only view of the child edges of {@code i}, letter to child index. */
    public Int2IntMap children(int i) {
        validator.validateActiveNodeIndex(i);
        return Int2IntMaps.unmodifiable(arena.node(i).childMap());
    }

    /** Whether {@code i} is an active node; throws only if {@code i} was never issued. */
    public boolean isActive(int i) {
        validator.validateNodeIndex(i);
        return arena.isActive(i);
    }

    /** Number of node slots, active and inactive. */
    public int numberOfNodes() {
        return arena.size();
    }

    public int numberOfActiveNodes() {
        return arena.activeCount();
    }

    /** Number of distinct words in the trie, that is, of terminal nodes. */
    public int numberOfWords() {
        return numberOfWords;
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    /**
     * @throws NodeIndexException of kind {@code INVALID} if {@code i} is not the
     *         index of a node, active or inactive
     */
    public void validateNodeIndex(int i) {
        validator.validateNodeIndex(i);
    }

    /**
     * @throws NodeIndexException if {@link #validateNodeIndex(int)} throws, or of
     *         kind {@code INACTIVE} if {@code i} is not an active node
     */
    public void validateActiveNodeIndex(int i) {
        validator.validateActiveNodeIndex(i);
    }

    public AutomatonStats stats() {
        return stats;
    }

    public AutomatonConfiguration configuration() {
        return config;
    }

    @Override
    public String toString() {
        return "<AhoCorasick with " + arena.activeCount() + " nodes>";
    }

    /** The {@code char} values of {@code word} as symbols. */
    public static int[] toSymbols(CharSequence word) {
        Objects.requireNonNull(word, "word");
        int[] symbols = new int[word.length()];
        for (int i = 0; i < symbols.length; i++) {
            symbols[i] = word.charAt(i);
        }
        return symbols;
    }

    private static void checkSymbols(int[] word) {
        for (int i = 0; i < word.length; i++) {
            if (word[i] < 0) {
                throw new IllegalArgumentException("negative symbol " + word[i] + " at position " + i);
            }
        }
    }
}
