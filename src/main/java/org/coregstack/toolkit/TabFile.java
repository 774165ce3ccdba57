package org.coregstack.toolkit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Burst SLC tab file: one {@code slc par tops_par} line per subswath.
 *
 * @param subswaths the subswath entries, IW1 first
 */
public record TabFile(List<TabFile.Subswath> subswaths) {

    /** Number of subswaths of an interferometric wide swath scene. */
    public static final int IW_SUBSWATHS = 3;

    /**
     * Files of one subswath.
     */
    public record Subswath(Path slc, Path par, Path topsPar) {
    }

    public TabFile {
        if (subswaths.isEmpty()) {
            throw new IllegalArgumentException("A tab file needs at least one subswath");
        }
        subswaths = List.copyOf(subswaths);
    }

    /**
     * Tab file of the IW1..IW3 subswath files named {@code {stem}_IW{n}.slc(.par|.TOPS_par)} in {@code directory}.
     */
    public static TabFile forScene(Path directory, String stem) {
        List<Subswath> subswaths = new ArrayList<>(IW_SUBSWATHS);
        for (int swath = 1; swath <= IW_SUBSWATHS; swath++) {
            String name = stem + "_IW" + swath;
            subswaths.add(new Subswath(
                    directory.resolve(name + ".slc"),
                    directory.resolve(name + ".slc.par"),
                    directory.resolve(name + ".slc.TOPS_par")));
        }
        return new TabFile(subswaths);
    }

    public static TabFile read(Path path) throws IOException {
        List<Subswath> subswaths = new ArrayList<>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            String[] fields = line.trim().split("\\s+");
            if (fields.length != 3) {
                throw new ParameterFileException("Tab file " + path + " line has " + fields.length
                        + " fields instead of 3: '" + line + "'");
            }
            subswaths.add(new Subswath(Path.of(fields[0]), Path.of(fields[1]), Path.of(fields[2])));
        }
        if (subswaths.isEmpty()) {
            throw new ParameterFileException("Tab file " + path + " lists no subswaths");
        }
        return new TabFile(subswaths);
    }

    /** Subswath {@code number}, 1-based. */
    public Subswath subswath(int number) {
        return subswaths.get(number - 1);
    }

    public void write(Path path) throws IOException {
        StringBuilder content = new StringBuilder();
        for (Subswath subswath : subswaths) {
            content.append(subswath.slc()).append(' ')
                    .append(subswath.par()).append(' ')
                    .append(subswath.topsPar()).append('\n');
        }
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        // concurrent pairs rewrite the tab file of the shared reference scene
        Path directory = parent == null ? Path.of(".") : parent;
        Path temporary = Files.createTempFile(directory, path.getFileName() + ".", ".tmp");
        Files.writeString(temporary, content.toString(), StandardCharsets.UTF_8);
        Files.move(temporary, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
