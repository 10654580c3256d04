package datagenerators;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

// Seeded word and text generators over the integer alphabet [0, alphabetSize).
public class Generator {

    private final RandomGenerator rng;

    public Generator(long seed) {
        this.rng = new Well19937c(seed);
    }

    public int[] uniformWord(int minLength, int maxLength, int alphabetSize) {
        checkAlphabet(alphabetSize);
        checkLengths(minLength, maxLength);
        int length = minLength + rng.nextInt(maxLength - minLength + 1);
        int[] word = new int[length];
        for (int i = 0; i < length; i++) {
            word[i] = rng.nextInt(alphabetSize);
        }
        return word;
    }

    public List<int[]> uniformWords(int count, int minLength, int maxLength, int alphabetSize) {
        List<int[]> words = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            words.add(uniformWord(minLength, maxLength, alphabetSize));
        }
        return words;
    }

    public int[] uniformText(int length, int alphabetSize) {
        return uniformWord(length, length, alphabetSize);
    }

    public int[] zipfText(int length, int alphabetSize, double exponent) {
        checkAlphabet(alphabetSize);
        // ZipfDistribution samples integers in the closed interval [1, alphabetSize]
        ZipfDistribution dist = new ZipfDistribution(rng, alphabetSize, exponent);
        int[] text = new int[length];
        for (int i = 0; i < length; i++) {
            text[i] = dist.sample() - 1;            // rank 1 is the most frequent symbol 0
        }
        return text;
    }

    /** Cuts {@code count} random factors out of {@code text}, so every one of them occurs. */
    public List<int[]> factorsOf(int[] text, int count, int minLength, int maxLength) {
        checkLengths(minLength, maxLength);
        if (text.length < maxLength) {
            throw new IllegalArgumentException("text shorter than maxLength");
        }
        List<int[]> words = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int length = minLength + rng.nextInt(maxLength - minLength + 1);
            int start = rng.nextInt(text.length - length + 1);
            int[] word = new int[length];
            System.arraycopy(text, start, word, 0, length);
            words.add(word);
        }
        return words;
    }

    // Lower-case latin rendering of a word, for alphabets of at most 26 symbols.
    public static String toLatin(int[] word) {
        char[] chars = new char[word.length];
        for (int i = 0; i < word.length; i++) {
            if (word[i] < 0 || word[i] >= 26) {
                throw new IllegalArgumentException("symbol " + word[i] + " has no latin letter");
            }
            chars[i] = (char) ('a' + word[i]);
        }
        return new String(chars);
    }

    private static void checkLengths(int minLength, int maxLength) {
        if (minLength < 0 || maxLength < minLength) {
            throw new IllegalArgumentException("need 0 <= minLength <= maxLength");
        }
    }

    private static void checkAlphabet(int alphabetSize) {
        if (alphabetSize <= 0) {
            throw new IllegalArgumentException("alphabetSize must be positive");
        }
    }
}
