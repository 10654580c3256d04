package search;

import java.util.List;

public interface PatternMatcher {

    /** @return {@code true} if the pattern was not present before. */
    boolean addPattern(int[] pattern);

    /** @return {@code true} if the pattern was present and has been removed. */
    boolean removePattern(int[] pattern);

    boolean containsPattern(int[] pattern);

    /** Every occurrence of every pattern in {@code text}, ordered by end position. */
    List<Match> report(int[] text);

    boolean containsMatch(int[] text);

    int numberOfPatterns();
}
