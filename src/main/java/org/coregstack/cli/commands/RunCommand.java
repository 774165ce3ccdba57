package org.coregstack.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;

import org.coregstack.pipeline.StackRunner;

import picocli.CommandLine.Command;

/**
 * Runs every task of the stack that has no completion marker yet.
 */
@Command(
    name = "run",
    description = "Coregister the stack; tasks with a completion marker are skipped"
)
public class RunCommand extends AbstractStackCommand {

    @Override
    protected int execute(StackRunner runner, PrintWriter out) throws IOException {
        return exitCode(runner.run(), out);
    }
}
