package utilities;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Iterates the non-blank lines of a UTF-8 word list. Lines starting with
 * {@code #} are comments. Surrounding whitespace is stripped.
 */
public class WordListReader implements Iterable<String>, AutoCloseable {

    private final Path path;
    private BufferedReader reader;
    private boolean opened;
    private boolean closed;

    public WordListReader(Path path) {
        this.path = path;
    }

    public static List<String> readAll(Path path) throws IOException {
        List<String> words = new ArrayList<>();
        try (WordListReader reader = new WordListReader(path)) {
            reader.open();
            for (String w : reader) {
                words.add(w);
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return words;
    }

    public void open() throws IOException {
        if (opened) {
            return;
        }
        if (closed) {
            throw new IllegalStateException("Reader already closed");
        }
        this.reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        this.opened = true;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        opened = false;
        if (reader != null) {
            try {
                reader.close();
            } finally {
                reader = null;
            }
        }
    }

    @Override
    public Iterator<String> iterator() {
        if (!opened) {
            throw new IllegalStateException("Reader not opened");
        }
        return new Iterator<>() {
            private String next = advance();

            private String advance() {
                try {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        String word = line.strip();
                        if (!word.isEmpty() && !word.startsWith("#")) {
                            return word;
                        }
                    }
                    return null;
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public String next() {
                if (next == null) {
                    throw new NoSuchElementException();
                }
                String current = next;
                next = advance();
                return current;
            }
        };
    }
}
