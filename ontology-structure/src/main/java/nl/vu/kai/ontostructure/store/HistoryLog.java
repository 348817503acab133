package nl.vu.kai.ontostructure.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.stream.Stream;

/**
 * Append-only text file recording every structural change applied to a dataset.
 * SPARQL changes are written as {@code ```sparql ... ```} blocks, decisions as plain lines.
 */
public class HistoryLog {

    private final Path file;
    private int lines;

    public HistoryLog(Path file) throws IOException {
        this.file = file;
        if (Files.exists(file)) {
            try (Stream<String> existing = Files.lines(file, StandardCharsets.UTF_8)) {
                this.lines = (int) existing.count();
            }
        } else {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
            this.lines = 0;
        }
    }

    public synchronized int lineCount() {
        return lines;
    }

    public synchronized void append(String entry) {
        try {
            Files.writeString(file, entry + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append to history " + file, e);
        }
        lines += entry.split("\n", -1).length;
    }

    public String read() throws IOException {
        return Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : "";
    }

    public Path getFile() {
        return file;
    }
}
