package search;

import automaton.AhoCorasick;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class MatchProcessorTest {

    @Test
    void test_process_reports_longest_match() {
        AhoCorasick ac = new AhoCorasick();
        ac.addWord("he");
        ac.addWord("she");
        ac.addWord("hers");
        MatchProcessor processor = new MatchProcessor(ac);

        Assertions.assertFalse(processor.process('u'));
        Assertions.assertFalse(processor.process('s'));
        Assertions.assertFalse(processor.process('h'));
        Assertions.assertTrue(processor.process('e'));
        Assertions.assertEquals(ac.traverseWord("she"), processor.matchedNode());
        Assertions.assertFalse(processor.process('r'));
        Assertions.assertEquals(AhoCorasick.UNDEFINED, processor.matchedNode());
        Assertions.assertTrue(processor.process('s'));
        Assertions.assertEquals(ac.traverseWord("hers"), processor.matchedNode());
        Assertions.assertEquals(6, processor.position());
    }

    @Test
    void test_match_through_suffix_link() {
        AhoCorasick ac = new AhoCorasick();
        ac.addWord("abcd");
        ac.addWord("bc");
        MatchProcessor processor = new MatchProcessor(ac);
        processor.process('a');
        processor.process('b');
        // state is "abc", which is not terminal, but its suffix "bc" is
        Assertions.assertTrue(processor.process('c'));
        Assertions.assertEquals(ac.traverseWord("abc"), processor.state());
        Assertions.assertEquals(ac.traverseWord("bc"), processor.matchedNode());
    }

    @Test
    void test_reset() {
        AhoCorasick ac = new AhoCorasick();
        ac.addWord("ab");
        MatchProcessor processor = new MatchProcessor(ac);
        processor.process('a');
        processor.reset();
        Assertions.assertEquals(AhoCorasick.ROOT, processor.state());
        Assertions.assertEquals(0, processor.position());
        Assertions.assertFalse(processor.process('b'));
    }
}
