package org.coregstack.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;

import org.coregstack.cli.CommandLineInterface;
import org.coregstack.pipeline.StackDefinition;
import org.coregstack.pipeline.StackRunner;
import org.coregstack.tree.CoregistrationEdge;
import org.coregstack.tree.CoregistrationForest;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Builds the coregistration tree of the configured stack, writes its list files and prints it.
 */
@Command(
    name = "tree",
    description = "Build the coregistration tree and write the tier and interferogram lists"
)
public class TreeCommand extends AbstractStackCommand {

    @Option(
        names = {"--edges"},
        description = "Also print the local reference of every date"
    )
    private boolean printEdges;

    @Override
    protected int execute(StackRunner runner, PrintWriter out) throws IOException {
        StackDefinition stack = runner.define();
        CoregistrationForest forest = stack.forest();

        out.printf("Reference: %s%n", forest.reference());
        forest.tiers().forEach(tier ->
                out.printf("Tier %d (%s): %s%n", tier.index(), runner.paths().tierList(tier.index()), tier.dates()));
        if (!forest.unreachable().isEmpty()) {
            out.printf("Unreachable: %s%n", forest.unreachable());
        }
        if (printEdges) {
            for (CoregistrationEdge edge : forest.edges()) {
                out.println("  " + edge);
            }
        }
        out.printf("Interferograms: %d (%s)%n", stack.interferograms().size(), runner.paths().interferogramList());
        return CommandLineInterface.EXIT_OK;
    }
}
