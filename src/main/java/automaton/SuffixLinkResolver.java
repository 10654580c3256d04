package automaton;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterator;
import utilities.AutomatonLogger;

/**
 * Computes suffix links on demand and memoizes them until the next structural
 * change of the trie. A link is current when the node's {@code linkVersion}
 * equals {@link #version()}; bumping the version invalidates every link at once.
 */
final class SuffixLinkResolver {

    private final NodeArena arena;
    private final AutomatonStats stats;
    private int version;

    // Scratch stack of ancestors whose links are stale.
    private final IntArrayList pending = new IntArrayList();

    SuffixLinkResolver(NodeArena arena, AutomatonStats stats) {
        this.arena = arena;
        this.stats = stats;
    }

    SuffixLinkResolver(SuffixLinkResolver that, NodeArena arena, AutomatonStats stats) {
        this.arena = arena;
        this.stats = stats;
        this.version = that.version;
    }

    int version() {
        return version;
    }

    void invalidate() {
        version++;
        stats.recordInvalidation();
    }

    boolean isCurrent(int index) {
        Node node = arena.node(index);
        return node.linkVersion == version && node.suffixLink != AhoCorasick.UNDEFINED;
    }

    /** Suffix link of an active node; the caller has validated {@code index}. */
    int suffixLink(int index) {
        if (index == AhoCorasick.ROOT) {
            return AhoCorasick.ROOT;
        }
        if (isCurrent(index)) {
            return arena.node(index).suffixLink;
        }
        // Walk up to the first ancestor with a usable link, then resolve top down.
        int current = index;
        while (current != AhoCorasick.ROOT && !isCurrent(current)) {
            pending.add(current);
            current = arena.node(current).parent;
        }
        int depth = pending.size();
        int[] chain = new int[depth];
        for (int k = 0; k < depth; k++) {
            chain[k] = pending.getInt(depth - 1 - k);
        }
        pending.clear();
        for (int n : chain) {
            resolve(n);
        }
        return arena.node(index).suffixLink;
    }

    // Requires the parent's link to be current (or the parent to be the root).
    private void resolve(int index) {
        Node node = arena.node(index);
        int link;
        if (node.parent == AhoCorasick.ROOT) {
            link = AhoCorasick.ROOT;
        } else {
            link = traverse(arena.node(node.parent).suffixLink, node.parentLetter);
        }
        node.suffixLink = link;
        node.linkVersion = version;
        stats.recordLinkResolved();
    }

    /** The goto/fail transition; the caller has validated {@code current}. */
    int traverse(int current, int letter) {
        while (true) {
            int next = arena.node(current).child(letter);
            if (next != AhoCorasick.UNDEFINED) {
                return next;
            }
            if (current == AhoCorasick.ROOT) {
                return AhoCorasick.ROOT;
            }
            current = suffixLink(current);
        }
    }

    /** Resolves every active link breadth first, parents before children. */
    void resolveAll() {
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(AhoCorasick.ROOT);
        int resolved = 0;
        while (!queue.isEmpty()) {
            int index = queue.dequeueInt();
            if (index != AhoCorasick.ROOT && !isCurrent(index)) {
                resolve(index);
                resolved++;
            }
            IntIterator children = arena.node(index).children.values().iterator();
            while (children.hasNext()) {
                queue.enqueue(children.nextInt());
            }
        }
        AutomatonLogger.trace("resolved " + resolved + " suffix links at version " + version);
    }
}
