package org.coregstack.stack;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Reads and writes stack list files: one date, or one {@code primary,secondary} pair, per line.
 * <p>
 * Blank lines are ignored on read. Files are written without a trailing newline, matching the
 * list files produced by earlier versions of the stack tooling.
 */
public final class ListFiles {

    private ListFiles() {
    }

    public static List<AcquisitionDate> readDates(Path listFile) throws IOException {
        List<AcquisitionDate> dates = new ArrayList<>();
        for (String line : Files.readAllLines(listFile, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                dates.add(AcquisitionDate.parse(line));
            }
        }
        return dates;
    }

    public static void writeDates(Path listFile, Collection<AcquisitionDate> dates) throws IOException {
        List<String> lines = new ArrayList<>(dates.size());
        for (AcquisitionDate date : dates) {
            lines.add(date.toString());
        }
        write(listFile, lines);
    }

    public static List<DatePair> readPairs(Path listFile) throws IOException {
        List<DatePair> pairs = new ArrayList<>();
        for (String line : Files.readAllLines(listFile, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                pairs.add(DatePair.parse(line));
            }
        }
        return pairs;
    }

    public static void writePairs(Path listFile, Collection<DatePair> pairs) throws IOException {
        List<String> lines = new ArrayList<>(pairs.size());
        for (DatePair pair : pairs) {
            lines.add(pair.toString());
        }
        write(listFile, lines);
    }

    private static void write(Path listFile, List<String> lines) throws IOException {
        Path parent = listFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(listFile, String.join("\n", lines), StandardCharsets.UTF_8);
    }
}
