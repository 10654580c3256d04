package utilities;

import automaton.AhoCorasick;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class MemUtilTest {

    @Test
    void test_report_describes_trie() {
        AhoCorasick ac = new AhoCorasick();
        ac.addWord("he");
        ac.addWord("she");
        ac.rmWord("she");

        String report = new MemUtil().jolMemoryReport(false, ac);
        Assertions.assertTrue(report.contains("Node slots        : 6 (active 3)"), report);
        Assertions.assertTrue(report.contains("Total bytes"));
        Assertions.assertFalse(report.contains("--- Class footprint ---"));
    }

    @Test
    void test_footprint_table_is_optional() {
        AhoCorasick ac = new AhoCorasick();
        ac.addWord("abc");
        String report = new MemUtil().jolMemoryReport(true, ac);
        Assertions.assertTrue(report.contains("--- Class footprint ---"));
    }

    @Test
    void test_total_bytes_grows_with_trie() {
        MemUtil mem = new MemUtil();
        AhoCorasick ac = new AhoCorasick();
        long empty = mem.totalBytes(ac);
        Assertions.assertTrue(empty > 0);
        for (int i = 0; i < 100; i++) {
            ac.addWord(Integer.toString(i * 7919));
        }
        Assertions.assertTrue(mem.totalBytes(ac) > empty);
    }
}
