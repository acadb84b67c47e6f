package org.empiresim.cli.commands.node;

import com.typesafe.config.Config;
import org.empiresim.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the node in the foreground until interrupted."
)
public class NodeRunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeRunCommand.class);

    @ParentCommand
    private NodeCommand parent;

    @Override
    public Integer call() {
        final Config config = parent.nodeConfig();
        final Node node = new Node(config);
        node.start();

        // The node's shutdown hook stops the processes on exit.
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            node.stop();
            LOGGER.info("Node stopped.");
        }
        return 0;
    }
}
