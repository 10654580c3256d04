package automaton;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;

// Storage record for one arena slot. Fields are owned by NodeArena and AhoCorasick.
final class Node {

    int parent;
    int parentLetter;
    int height;
    boolean terminal;
    boolean active;

    // Cached suffix link, only meaningful while linkVersion matches the trie's version.
    int suffixLink;
    int linkVersion;

    final Int2IntOpenHashMap children;

    Node(int childCapacity) {
        this.children = new Int2IntOpenHashMap(childCapacity);
        this.children.defaultReturnValue(AhoCorasick.UNDEFINED);
        clear();
    }

    Node(Node that) {
        this.children = new Int2IntOpenHashMap(that.children);
        this.children.defaultReturnValue(AhoCorasick.UNDEFINED);
        this.parent = that.parent;
        this.parentLetter = that.parentLetter;
        this.height = that.height;
        this.terminal = that.terminal;
        this.active = that.active;
        this.suffixLink = that.suffixLink;
        this.linkVersion = that.linkVersion;
    }

    void clear() {
        parent = AhoCorasick.UNDEFINED;
        parentLetter = AhoCorasick.UNDEFINED;
        height = 0;
        terminal = false;
        active = false;
        suffixLink = AhoCorasick.UNDEFINED;
        linkVersion = -1;
        children.clear();
    }

    int child(int letter) {
        return children.get(letter);
    }

    int numberOfChildren() {
        return children.size();
    }

    Int2IntMap childMap() {
        return children;
    }
}
