package org.coregstack.toolkit;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one toolkit invocation.
 *
 * @param command the executed command line, program first
 * @param status  the exit status, 0 on success
 * @param stdout  captured standard output
 * @param stderr  captured standard error
 */
public record ToolResult(List<String> command, int status, String stdout, String stderr) {

    public ToolResult {
        command = List.copyOf(command);
    }

    public boolean succeeded() {
        return status == 0;
    }

    /** Name of the program without its install directory. */
    public String program() {
        if (command.isEmpty()) {
            return "";
        }
        Path name = Path.of(command.get(0)).getFileName();
        return name == null ? command.get(0) : name.toString();
    }
}
