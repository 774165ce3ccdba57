package org.coregstack.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.coregstack.cli.CommandLineInterface;
import org.coregstack.pipeline.StackRunner;
import org.coregstack.scheduler.RunReport;
import org.coregstack.scheduler.StructuralException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Common frame of the stack commands: loads the configuration, builds the {@link StackRunner} and
 * maps configuration and structural errors to exit code 1.
 */
abstract class AbstractStackCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractStackCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            Config config = parent.getConfig();
            StackRunner runner = StackRunner.fromConfig(config.getConfig("coregstack"));
            return execute(runner, spec.commandLine().getOut());
        } catch (ConfigException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return CommandLineInterface.EXIT_ERROR;
        } catch (StructuralException e) {
            log.error("Stack structure error: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return CommandLineInterface.EXIT_ERROR;
        } catch (IOException e) {
            log.error("I/O error: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return CommandLineInterface.EXIT_ERROR;
        }
    }

    protected abstract int execute(StackRunner runner, PrintWriter out) throws IOException;

    /** Exit code of a finished run. */
    protected static int exitCode(RunReport report, PrintWriter out) {
        out.println(report.summaryLine());
        return report.hasFailures() ? CommandLineInterface.EXIT_TASK_FAILURES : CommandLineInterface.EXIT_OK;
    }
}
