package org.coregstack.toolkit;

import java.util.List;

/**
 * A toolkit program exited with a non-zero status, timed out or could not be started.
 * <p>
 * Carries the command line and the captured output so the enclosing step can log it and
 * decide whether the failure is recoverable.
 */
public class ToolInvocationException extends RuntimeException {

    /** Status reported when the program did not start, timed out or was interrupted. */
    public static final int NO_EXIT_STATUS = -1;

    private final List<String> command;
    private final int status;
    private final String stdout;
    private final String stderr;

    public ToolInvocationException(ToolResult result) {
        this("Toolkit command " + result.program() + " failed with status " + result.status(), result, null);
    }

    public ToolInvocationException(String message, ToolResult result, Throwable cause) {
        super(message, cause);
        this.command = result.command();
        this.status = result.status();
        this.stdout = result.stdout();
        this.stderr = result.stderr();
    }

    public List<String> getCommand() {
        return command;
    }

    public int getStatus() {
        return status;
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }
}
