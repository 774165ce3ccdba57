package org.coregstack.toolkit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A toolkit parameter file: {@code key: value [value ...]} lines, possibly preceded by header lines.
 * <p>
 * Lines are kept verbatim. Writing the file back reproduces every untouched line byte for byte,
 * only the lines of keys changed through {@link #set(String, String...)} are reformatted.
 * Typed getters fail with {@link ParameterFileException} on a missing key, a missing value index
 * or a malformed number, never with a default.
 */
public final class ParameterFile {

    private final Path source;
    private final List<String> lines;
    private final Map<String, Integer> lineByKey;
    private final boolean trailingNewline;

    private ParameterFile(Path source, List<String> lines, boolean trailingNewline) {
        this.source = source;
        this.lines = lines;
        this.trailingNewline = trailingNewline;
        this.lineByKey = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            String key = keyOf(lines.get(i));
            if (key != null) {
                lineByKey.putIfAbsent(key, i);
            }
        }
    }

    /**
     * Reads a parameter file.
     *
     * @param path the file
     * @return the parsed file
     * @throws IOException if the file cannot be read
     */
    public static ParameterFile read(Path path) throws IOException {
        return parse(path, Files.readString(path, StandardCharsets.UTF_8));
    }

    static ParameterFile parse(Path source, String content) {
        boolean trailingNewline = content.endsWith("\n");
        String body = trailingNewline ? content.substring(0, content.length() - 1) : content;
        List<String> lines = body.isEmpty() ? new ArrayList<>() : new ArrayList<>(Arrays.asList(body.split("\n", -1)));
        return new ParameterFile(source, lines, trailingNewline);
    }

    private static String keyOf(String line) {
        int colon = line.indexOf(':');
        if (colon <= 0) {
            return null;
        }
        String key = line.substring(0, colon).trim();
        if (key.isEmpty() || key.chars().anyMatch(Character::isWhitespace)) {
            return null;
        }
        return key;
    }

    public Path source() {
        return source;
    }

    public boolean contains(String key) {
        return lineByKey.containsKey(key);
    }

    /** Keys in file order. */
    public Set<String> keys() {
        return Collections.unmodifiableSet(lineByKey.keySet());
    }

    /**
     * Raw value text of {@code key}, surrounding whitespace removed.
     */
    public String getRaw(String key) {
        Integer index = lineByKey.get(key);
        if (index == null) {
            throw new ParameterFileException("Key '" + key + "' not found in " + describe());
        }
        String line = lines.get(index);
        return line.substring(line.indexOf(':') + 1).trim();
    }

    /** Whitespace separated values of {@code key}, units included. */
    public List<String> getValues(String key) {
        String raw = getRaw(key);
        return raw.isEmpty() ? List.of() : List.of(raw.split("\\s+"));
    }

    public String getString(String key, int index) {
        List<String> values = getValues(key);
        if (index < 0 || index >= values.size()) {
            throw new ParameterFileException("Key '" + key + "' in " + describe() + " has "
                    + values.size() + " values, no value at index " + index);
        }
        return values.get(index);
    }

    public double getDouble(String key, int index) {
        String value = getString(key, index);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ParameterFileException("Value '" + value + "' of key '" + key + "' in "
                    + describe() + " is not a number", e);
        }
    }

    public int getInt(String key, int index) {
        String value = getString(key, index);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ParameterFileException("Value '" + value + "' of key '" + key + "' in "
                    + describe() + " is not an integer", e);
        }
    }

    /**
     * The first {@code count} values of {@code key} as numbers.
     */
    public double[] getDoubles(String key, int count) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = getDouble(key, i);
        }
        return values;
    }

    /**
     * Replaces the values of {@code key}, appending the key if the file does not have it.
     */
    public ParameterFile set(String key, String... values) {
        String line = key + ":  " + String.join("  ", values);
        Integer index = lineByKey.get(key);
        if (index == null) {
            lineByKey.put(key, lines.size());
            lines.add(line);
        } else {
            lines.set(index, line);
        }
        return this;
    }

    public ParameterFile setDoubles(String key, double... values) {
        String[] rendered = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            rendered[i] = Double.toString(values[i]);
        }
        return set(key, rendered);
    }

    public String render() {
        String body = String.join("\n", lines);
        return trailingNewline ? body + "\n" : body;
    }

    /**
     * Writes the file to {@code target}, creating parent directories as needed.
     */
    public void write(Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, render(), StandardCharsets.UTF_8);
    }

    private String describe() {
        return source == null ? "parameter file" : source.toString();
    }
}
