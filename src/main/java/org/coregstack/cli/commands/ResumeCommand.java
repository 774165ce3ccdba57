package org.coregstack.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;

import org.coregstack.pipeline.StackRunner;

import picocli.CommandLine.Command;

/**
 * Reruns what an interrupted or partially failed run left incomplete, including upstream tasks
 * whose outputs have since disappeared.
 */
@Command(
    name = "resume",
    description = "Resume the stack: rerun failed, unfinished and invalidated tasks"
)
public class ResumeCommand extends AbstractStackCommand {

    @Override
    protected int execute(StackRunner runner, PrintWriter out) throws IOException {
        return exitCode(runner.resume(), out);
    }
}
