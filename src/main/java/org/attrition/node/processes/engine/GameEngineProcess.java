package org.attrition.node.processes.engine;

import com.typesafe.config.Config;
import org.attrition.engine.GameEngine;
import org.attrition.node.processes.AbstractProcess;
import org.attrition.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Owns the {@link GameEngine} and runs its game loop. Exposes the engine to dependent
 * processes.
 */
public class GameEngineProcess extends AbstractProcess implements IServiceProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(GameEngineProcess.class);

    private final GameEngine engine;

    public GameEngineProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        this.engine = GameEngine.create(options);
    }

    @Override
    public void start() {
        if (engine.isAutoStart()) {
            engine.getGameLoop().start();
        } else {
            LOGGER.info("Game loop auto-start disabled; ticks run only on demand.");
        }
    }

    @Override
    public void stop() {
        engine.close();
    }

    @Override
    public Object getExposedService() {
        return engine;
    }
}
