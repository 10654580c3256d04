package dot;

import automaton.AhoCorasick;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class AutomatonDotTest {

    @Test
    void test_projection_of_active_nodes() {
        AhoCorasick ac = new AhoCorasick();
        ac.addWord(new int[]{0, 1});
        ac.addWord(new int[]{0, 2, 3});
        ac.addWord(new int[]{4});
        ac.rmWord(new int[]{4});

        Dot dot = AutomatonDot.dot(ac);
        Assertions.assertEquals(ac.numberOfActiveNodes(), dot.nodes().size());
        Assertions.assertEquals(ac.numberOfActiveNodes() - 1, dot.edges().size());

        int ab = ac.traverseWord(new int[]{0, 1});
        Assertions.assertEquals("doublecircle", dot.node(Integer.toString(ab)).attr("shape"));
        Assertions.assertEquals("circle", dot.node("0").attr("shape"));
        Assertions.assertFalse(dot.hasNode("5"));

        Dot.Edge first = dot.edges().get(0);
        Assertions.assertEquals("0", first.from());
        Assertions.assertEquals("0", first.attr("label"));
        Assertions.assertEquals(Dot.COLORS[0], first.attr("color"));
    }

    @Test
    void test_projection_with_suffix_links() {
        AhoCorasick ac = new AhoCorasick();
        ac.addWord("he");
        ac.addWord("she");
        int nodes = ac.numberOfNodes();

        Dot dot = AutomatonDot.dot(ac, true);
        // child edges plus one dashed link per non-root node
        Assertions.assertEquals(2 * (ac.numberOfActiveNodes() - 1), dot.edges().size());
        Assertions.assertEquals(nodes, ac.numberOfNodes());

        String she = Integer.toString(ac.traverseWord("she"));
        String he = Integer.toString(ac.traverseWord("he"));
        boolean found = dot.edges().stream()
                .anyMatch(e -> e.from().equals(she) && e.to().equals(he) && "dashed".equals(e.attr("style")));
        Assertions.assertTrue(found);
        Assertions.assertTrue(dot.toString().startsWith("digraph \"AhoCorasick\" {"));
    }

    @Test
    void test_colour_cycles() {
        Assertions.assertEquals(Dot.COLORS[1], AutomatonDot.color(Dot.COLORS.length + 1));
    }
}
