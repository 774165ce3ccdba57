package org.coregstack.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import org.coregstack.cli.CommandLineInterface;
import org.coregstack.stack.AcquisitionDate;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

@Tag("unit")
class TreeCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testCommandParses() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKeys("tree", "run", "resume", "help");
    }

    @Test
    void testHelpOutput() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        cmdLine.execute("tree", "--help");

        assertThat(out.toString()).contains("tree").contains("--edges");
    }

    @Test
    void testPrintsTiersAndWritesLists() throws IOException {
        StackCommandFixture fixture = new StackCommandFixture(tempDir, "");
        fixture.writeScenes(AcquisitionDate.of(2020, 1, 1), AcquisitionDate.of(2020, 1, 13),
                AcquisitionDate.of(2020, 1, 25), AcquisitionDate.of(2020, 6, 1));

        int exitCode = fixture.execute("tree", "--edges");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        String output = fixture.out.toString();
        assertThat(output).contains("Reference: 20200113");
        assertThat(output).contains("Tier 1 (").contains("[20200101, 20200125]");
        assertThat(output).contains("Tier 2 (").contains("[20200601]");
        assertThat(output).contains("Interferograms: 5");
        assertThat(tempDir.resolve("out/lists/secondaries2.list")).exists();
        assertThat(tempDir.resolve("out/lists/ifgs.list")).exists();
    }

    @Test
    void testReferenceOutsideStackIsStructuralError() throws IOException {
        StackCommandFixture fixture = new StackCommandFixture(tempDir, "20210101");
        fixture.writeScenes(AcquisitionDate.of(2020, 1, 1), AcquisitionDate.of(2020, 1, 13));

        int exitCode = fixture.execute("tree");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_ERROR);
        assertThat(fixture.err.toString()).contains("20210101");
    }

    @Test
    void testMissingConfigFileIsError() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("--config", tempDir.resolve("absent.conf").toString(), "tree");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_ERROR);
        assertThat(err.toString()).contains("absent.conf");
    }
}
