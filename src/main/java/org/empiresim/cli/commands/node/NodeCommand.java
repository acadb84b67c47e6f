package org.empiresim.cli.commands.node;

import com.typesafe.config.Config;
import org.empiresim.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "node",
    description = "Runs the EmpireSim node hosting the tick engine and its admin API",
    subcommands = {
        NodeRunCommand.class
    }
)
public class NodeCommand {

    @ParentCommand
    private CommandLineInterface parent;

    /**
     * Full node configuration, loaded on first use.
     */
    Config nodeConfig() {
        return parent.getConfig();
    }
}
