package org.coregstack.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.coregstack.cli.CommandLineInterface;
import org.coregstack.stack.AcquisitionDate;
import org.coregstack.stack.ListFiles;

import picocli.CommandLine;

/**
 * A configuration file pointing a stack at a temporary directory, and a command line with captured output.
 */
final class StackCommandFixture {

    final Path root;
    final Path config;
    final StringWriter out = new StringWriter();
    final StringWriter err = new StringWriter();

    StackCommandFixture(Path root, String referenceDate) throws IOException {
        this.root = root;
        this.config = root.resolve("coregstack.conf");
        Files.writeString(config, String.join("\n",
                "coregstack {",
                "  logging.format = \"PLAIN\"",
                "  stack {",
                "    id = \"s1\"",
                "    output-dir = \"" + root.resolve("out").toAbsolutePath() + "\"",
                "    reference-date = \"" + referenceDate + "\"",
                "    ifg-connections = 2",
                "  }",
                "  scheduler.workers = 1",
                "  toolkit.install-dir = \"" + root.resolve("install").toAbsolutePath() + "\"",
                "}"));
    }

    void writeScenes(AcquisitionDate... dates) throws IOException {
        ListFiles.writeDates(root.resolve("out/lists/scenes.list"), List.of(dates));
    }

    int execute(String... args) {
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = config.toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        return commandLine.execute(withConfig);
    }
}
