package automaton;

import datagenerators.Generator;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class SuffixLinkResolverTest {

    // Signature of every active node, mapped to its index.
    private static Map<IntArrayList, Integer> bySignature(AhoCorasick ac) {
        Map<IntArrayList, Integer> out = new HashMap<>();
        for (int n = 0; n < ac.numberOfNodes(); n++) {
            if (ac.isActive(n)) {
                Integer previous = out.put(IntArrayList.wrap(ac.signature(n)), n);
                Assertions.assertNull(previous, "two active nodes share a signature");
            }
        }
        return out;
    }

    // Node of the longest suffix of word, starting from offset `from`, present in the trie.
    private static int longestSuffix(Map<IntArrayList, Integer> trie, int[] word, int from) {
        for (int k = from; k <= word.length; k++) {
            Integer n = trie.get(IntArrayList.wrap(Arrays.copyOfRange(word, k, word.length)));
            if (n != null) {
                return n;
            }
        }
        throw new AssertionError("the empty word is always present");
    }

    private static void assertLinksMatchBruteForce(AhoCorasick ac, int alphabet) {
        Map<IntArrayList, Integer> trie = bySignature(ac);
        for (Map.Entry<IntArrayList, Integer> e : trie.entrySet()) {
            int[] sig = e.getKey().toIntArray();
            int n = e.getValue();
            int expected = sig.length == 0 ? AhoCorasick.ROOT : longestSuffix(trie, sig, 1);
            Assertions.assertEquals(expected, ac.suffixLink(n), "link of " + e.getKey());

            for (int a = 0; a < alphabet; a++) {
                int[] extended = Arrays.copyOf(sig, sig.length + 1);
                extended[sig.length] = a;
                Assertions.assertEquals(longestSuffix(trie, extended, 0), ac.traverse(n, a),
                        "traverse " + e.getKey() + " by " + a);
            }
        }
    }

    @Test
    void test_random_tries_against_brute_force() {
        for (long seed = 1; seed <= 5; seed++) {
            Generator gen = new Generator(seed);
            AhoCorasick ac = new AhoCorasick();
            List<int[]> words = gen.uniformWords(150, 0, 7, 3);
            for (int[] w : words) {
                ac.addWord(w);
            }
            assertLinksMatchBruteForce(ac, 3);

            for (int i = 0; i < words.size(); i += 3) {
                ac.rmWord(words.get(i));
            }
            assertLinksMatchBruteForce(ac, 3);

            for (int[] w : gen.uniformWords(40, 1, 9, 3)) {
                ac.addWord(w);
            }
            assertLinksMatchBruteForce(ac, 3);
        }
    }

    @Test
    void test_removal_then_readd_matches_fresh_build() {
        Generator gen = new Generator(99L);
        List<int[]> words = gen.uniformWords(200, 1, 8, 4);
        AhoCorasick churned = new AhoCorasick();
        AhoCorasick fresh = new AhoCorasick();
        for (int[] w : words) {
            churned.addWord(w);
        }
        for (int[] w : words) {
            churned.rmWord(w);
        }
        Assertions.assertEquals(1, churned.numberOfActiveNodes());
        for (int[] w : words) {
            churned.addWord(w);
            fresh.addWord(w);
        }
        Assertions.assertEquals(fresh.numberOfActiveNodes(), churned.numberOfActiveNodes());
        Assertions.assertEquals(fresh.numberOfNodes(), churned.numberOfNodes());
        for (int[] w : words) {
            int a = churned.traverseWord(w);
            int b = fresh.traverseWord(w);
            Assertions.assertArrayEquals(fresh.signature(fresh.suffixLink(b)),
                    churned.signature(churned.suffixLink(a)));
        }
    }

    @Test
    void test_lazy_resolution_only_touches_needed_nodes() {
        AhoCorasick ac = new AhoCorasick(AutomatonConfiguration.builder().collectStats(true).build());
        ac.addWord("abcabc");
        ac.addWord("zzzz");
        int deep = ac.traverseWord("abcabc");
        ac.suffixLink(deep);
        // abcabc and its stale ancestors, nothing on the zzzz branch
        Assertions.assertEquals(6, ac.stats().linksResolved());
        Assertions.assertFalse(ac.hasCurrentSuffixLink(ac.child(AhoCorasick.ROOT, 'z')));
        Assertions.assertArrayEquals(AhoCorasick.toSymbols("abc"), ac.signature(ac.suffixLink(deep)));

        ac.suffixLink(deep);
        Assertions.assertEquals(6, ac.stats().linksResolved());
    }

    @Test
    void test_long_word_resolves_without_deep_recursion() {
        AhoCorasick ac = new AhoCorasick();
        int[] word = new int[50_000];
        ac.addWord(word);
        int last = ac.traverseWord(word);
        Assertions.assertEquals(word.length, ac.height(last));
        Assertions.assertEquals(word.length - 1, ac.height(ac.suffixLink(last)));
    }
}
