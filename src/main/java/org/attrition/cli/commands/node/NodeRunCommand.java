package org.attrition.cli.commands.node;

import org.attrition.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the node and runs until interrupted."
)
public class NodeRunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeRunCommand.class);
    private static final String PID_FILE_NAME = ".attrition.pid";

    @ParentCommand
    private NodeCommand parent;

    @Option(names = {"-d", "--detach"}, description = "Write a PID file for running in the background.")
    private boolean detach;

    @Override
    public Integer call() throws IOException {
        final Node node = new Node(parent.getParent().getConfig());
        if (detach) {
            writePidFile();
        }
        node.start();
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.info("Node interrupted, shutting down.");
            node.stop();
        }
        return 0;
    }

    private void writePidFile() throws IOException {
        final File pidFile = new File(PID_FILE_NAME);
        try (PrintWriter writer = new PrintWriter(pidFile)) {
            writer.println(ProcessHandle.current().pid());
        }
        pidFile.deleteOnExit();
        LOGGER.info("PID file created at {}", pidFile.getAbsolutePath());
    }
}
