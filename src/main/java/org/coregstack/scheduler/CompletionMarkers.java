package org.coregstack.scheduler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Durable task completion markers: {@code {workdir}/{nodeId}_status_logs.out}.
 * <p>
 * An empty marker means the node succeeded, a marker whose first line starts with {@code FAILED}
 * means it ran and failed, and no marker means it never ran.
 */
public final class CompletionMarkers {

    public static final String SUFFIX = "_status_logs.out";
    public static final String FAILED = "FAILED";

    private final Path workDirectory;

    public CompletionMarkers(Path workDirectory) {
        this.workDirectory = workDirectory;
    }

    public Path workDirectory() {
        return workDirectory;
    }

    public Path markerFor(String nodeId) {
        return workDirectory.resolve(nodeId + SUFFIX);
    }

    /**
     * Status recorded for {@code nodeId}: {@link TaskStatus#PENDING} when it never ran.
     */
    public TaskStatus read(String nodeId) throws IOException {
        Path marker = markerFor(nodeId);
        if (!Files.exists(marker)) {
            return TaskStatus.PENDING;
        }
        List<String> lines = Files.readAllLines(marker, StandardCharsets.UTF_8);
        if (!lines.isEmpty() && lines.get(0).startsWith(FAILED)) {
            return TaskStatus.FAILED;
        }
        return TaskStatus.SUCCEEDED;
    }

    public void markSucceeded(String nodeId) throws IOException {
        write(nodeId, "");
    }

    public void markFailed(String nodeId) throws IOException {
        write(nodeId, FAILED);
    }

    /**
     * Removes the marker of {@code nodeId}, if any.
     *
     * @return true if a marker was deleted
     */
    public boolean clear(String nodeId) throws IOException {
        return Files.deleteIfExists(markerFor(nodeId));
    }

    private void write(String nodeId, String content) throws IOException {
        Files.createDirectories(workDirectory);
        Files.writeString(markerFor(nodeId), content, StandardCharsets.UTF_8);
    }
}
