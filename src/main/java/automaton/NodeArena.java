package automaton;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;

/**
 * Flat store of trie nodes addressed by index. Freed slots are kept on a free list
 * and handed out again before the store grows. The arena knows nothing about trie
 * invariants; callers decide what to allocate and free.
 */
final class NodeArena {

    private final ArrayList<Node> nodes;
    private final int childCapacity;
    private final AutomatonConfiguration.RecyclePolicy policy;
    private final AutomatonStats stats;

    // Only one of the two is used, depending on the policy.
    private final IntArrayList freeStack = new IntArrayList();
    private final IntArrayFIFOQueue freeQueue = new IntArrayFIFOQueue();

    private int activeCount;

    NodeArena(int initialCapacity,
              int childCapacity,
              AutomatonConfiguration.RecyclePolicy policy,
              AutomatonStats stats) {
        this.nodes = new ArrayList<>(initialCapacity);
        this.childCapacity = childCapacity;
        this.policy = policy;
        this.stats = stats;
        reset();
    }

    NodeArena(NodeArena that, AutomatonStats stats) {
        this.nodes = new ArrayList<>(that.nodes.size());
        for (Node n : that.nodes) {
            this.nodes.add(new Node(n));
        }
        this.childCapacity = that.childCapacity;
        this.policy = that.policy;
        this.stats = stats;
        this.activeCount = that.activeCount;
        this.freeStack.addAll(that.freeStack);
        // Rotate the source queue once so both end up in the same order.
        int pending = that.freeQueue.size();
        for (int k = 0; k < pending; k++) {
            int i = that.freeQueue.dequeueInt();
            that.freeQueue.enqueue(i);
            this.freeQueue.enqueue(i);
        }
    }

    /** Drops every slot and creates a fresh, active root at index 0. */
    void reset() {
        nodes.clear();
        freeStack.clear();
        freeQueue.clear();
        Node root = new Node(childCapacity);
        root.active = true;
        nodes.add(root);
        activeCount = 1;
    }

    /**
     * Returns the index of an active node with the given parent, edge letter and height.
     * The node has no children, is not terminal and has no cached suffix link.
     */
    int allocate(int parent, int parentLetter, int height) {
        int index = takeFree();
        Node node;
        if (index == AhoCorasick.UNDEFINED) {
            index = nodes.size();
            node = new Node(childCapacity);
            nodes.add(node);
            stats.recordAllocation(false);
        } else {
            node = nodes.get(index);
            node.clear();
            stats.recordAllocation(true);
        }
        node.parent = parent;
        node.parentLetter = parentLetter;
        node.height = height;
        node.active = true;
        activeCount++;
        return index;
    }

    /** Marks {@code index} inactive, wipes its fields and queues it for reuse. */
    void free(int index) {
        Node node = nodes.get(index);
        if (!node.active) {
            throw new IllegalStateException("node " + index + " is already free");
        }
        node.clear();
        activeCount--;
        if (policy == AutomatonConfiguration.RecyclePolicy.FIFO) {
            freeQueue.enqueue(index);
        } else {
            freeStack.add(index);
        }
        stats.recordFree();
    }

    private int takeFree() {
        if (policy == AutomatonConfiguration.RecyclePolicy.FIFO) {
            return freeQueue.isEmpty() ? AhoCorasick.UNDEFINED : freeQueue.dequeueInt();
        }
        return freeStack.isEmpty() ? AhoCorasick.UNDEFINED : freeStack.removeInt(freeStack.size() - 1);
    }

    Node node(int index) {
        return nodes.get(index);
    }

    boolean isActive(int index) {
        return nodes.get(index).active;
    }

    /** Total number of slots, active and inactive. */
    int size() {
        return nodes.size();
    }

    int activeCount() {
        return activeCount;
    }

    int freeCount() {
        return size() - activeCount;
    }
}
