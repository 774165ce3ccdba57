package org.coregstack.coreg;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends accuracy warnings to a scene's {@code ACCURACY_WARNING} file.
 * <p>
 * The file accumulates across runs; {@link #lines()} only holds what this instance wrote.
 * Safe for concurrent use by the burst overlap samplers of one pair.
 */
public final class AccuracyWarnings {

    public static final String FILE_NAME = "ACCURACY_WARNING";

    private final Path file;
    private final List<String> written = new ArrayList<>();

    public AccuracyWarnings(Path file) {
        this.file = file;
    }

    public static AccuracyWarnings inDirectory(Path directory) {
        return new AccuracyWarnings(directory.resolve(FILE_NAME));
    }

    public Path file() {
        return file;
    }

    public synchronized void append(String line) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, line + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to " + file, e);
        }
        written.add(line);
    }

    public synchronized List<String> lines() {
        return List.copyOf(written);
    }

    public synchronized boolean isEmpty() {
        return written.isEmpty();
    }
}
