package utilities;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

final class WordListReaderTest {

    @TempDir
    Path dir;

    @Test
    void test_skips_blanks_and_comments() throws IOException {
        Path file = dir.resolve("words.txt");
        Files.writeString(file, "# header\nhe\n\n  she  \n\t\nhis\n#hers\nhers\n", StandardCharsets.UTF_8);
        Assertions.assertEquals(List.of("he", "she", "his", "hers"), WordListReader.readAll(file));
    }

    @Test
    void test_iterates_after_open() throws IOException {
        Path file = dir.resolve("utf8.txt");
        Files.writeString(file, "naïve\ncafé\n", StandardCharsets.UTF_8);
        List<String> words = new ArrayList<>();
        try (WordListReader reader = new WordListReader(file)) {
            reader.open();
            reader.forEach(words::add);
        }
        Assertions.assertEquals(List.of("naïve", "café"), words);
    }

    @Test
    void test_iterator_requires_open() throws IOException {
        Path file = dir.resolve("empty.txt");
        Files.writeString(file, "", StandardCharsets.UTF_8);
        try (WordListReader reader = new WordListReader(file)) {
            Assertions.assertThrows(IllegalStateException.class, reader::iterator);
            reader.open();
            Assertions.assertFalse(reader.iterator().hasNext());
        }
    }

    @Test
    void test_cannot_reopen_after_close() throws IOException {
        Path file = dir.resolve("one.txt");
        Files.writeString(file, "a\n", StandardCharsets.UTF_8);
        WordListReader reader = new WordListReader(file);
        reader.open();
        reader.close();
        reader.close();
        Assertions.assertThrows(IllegalStateException.class, reader::open);
    }

    @Test
    void test_missing_file() {
        Assertions.assertThrows(NoSuchFileException.class,
                () -> WordListReader.readAll(dir.resolve("missing.txt")));
    }
}
