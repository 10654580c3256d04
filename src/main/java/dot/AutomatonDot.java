package dot;

import automaton.AhoCorasick;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;

// Projects the active part of a trie onto a Dot graph.
public final class AutomatonDot {

    private AutomatonDot() {}

    public static Dot dot(AhoCorasick ac) {
        return dot(ac, false);
    }

    /**
     * Nodes are the active trie nodes, named by index, terminal ones drawn as double
     * circles. Child edges are labelled and coloured by letter. With
     * {@code suffixLinks} each non-root node also gets a dashed edge to its suffix link,
     * which computes any stale links but leaves the trie's shape untouched.
     */
    public static Dot dot(AhoCorasick ac, boolean suffixLinks) {
        Dot result = new Dot("AhoCorasick");
        result.graphAttr("rankdir", "TB");

        // Breadth first from the root so the output order follows the trie levels.
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(AhoCorasick.ROOT);
        result.addNode(Integer.toString(AhoCorasick.ROOT)).attr("shape", shape(ac, AhoCorasick.ROOT));
        while (!queue.isEmpty()) {
            int parent = queue.dequeueInt();
            for (Int2IntMap.Entry e : ac.children(parent).int2IntEntrySet()) {
                int child = e.getIntValue();
                result.addNode(Integer.toString(child)).attr("shape", shape(ac, child));
                result.addEdge(Integer.toString(parent), Integer.toString(child))
                        .attr("label", Integer.toString(e.getIntKey()))
                        .attr("color", color(e.getIntKey()));
                queue.enqueue(child);
            }
        }

        if (suffixLinks) {
            for (Dot.Node node : result.nodes()) {
                int index = Integer.parseInt(node.name());
                if (index == AhoCorasick.ROOT) {
                    continue;
                }
                result.addEdge(node.name(), Integer.toString(ac.suffixLink(index)))
                        .attr("style", "dashed")
                        .attr("color", "gray");
            }
        }
        return result;
    }

    private static String shape(AhoCorasick ac, int index) {
        return ac.isTerminal(index) ? "doublecircle" : "circle";
    }

    static String color(int letter) {
        return Dot.COLORS[Math.floorMod(letter, Dot.COLORS.length)];
    }
}
