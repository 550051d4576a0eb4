package org.attrition.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.typesafe.config.Config;
import org.attrition.cli.CommandLineInterface;
import org.attrition.engine.GameEngine;
import org.attrition.engine.services.gameloop.TickSummary;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.util.concurrent.Callable;

/**
 * Runs game-loop ticks once against the configured store and prints each summary as JSON.
 */
@Command(
    name = "tick",
    description = "Runs game-loop ticks against the configured store and prints the summaries."
)
public class TickCommand implements Callable<Integer> {

    static final String ENGINE_OPTIONS_PATH = "node.processes.engine.options";

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-n", "--count"}, defaultValue = "1", description = "Number of ticks to run (default: 1).")
    private int count;

    @Override
    public Integer call() throws JsonProcessingException {
        if (count < 1) {
            throw new IllegalArgumentException("--count must be at least 1");
        }
        final Config config = parent.getConfig();
        final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        int errors = 0;
        try (GameEngine engine = GameEngine.create(config.getConfig(ENGINE_OPTIONS_PATH))) {
            for (int i = 0; i < count; i++) {
                final TickSummary summary = engine.getGameLoop().runOnce();
                errors += summary.totalErrors();
                spec.commandLine().getOut().println(mapper.writeValueAsString(summary.toMap()));
            }
        }
        spec.commandLine().getOut().flush();
        return errors == 0 ? 0 : 2;
    }
}
