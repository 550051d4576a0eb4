package org.attrition.cli.commands.node;

import org.attrition.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "node",
    description = "Manages the Attrition node",
    subcommands = {
        NodeRunCommand.class
    }
)
public class NodeCommand {

    @ParentCommand
    private CommandLineInterface parent;

    public CommandLineInterface getParent() {
        return parent;
    }
}
