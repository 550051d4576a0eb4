package org.attrition.node.processes.http.api.game;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiResponse;
import org.attrition.engine.GameEngine;
import org.attrition.engine.services.gameloop.GameLoopService;
import org.attrition.node.processes.http.AbstractController;
import org.attrition.node.processes.http.api.game.dto.GameLoopStatusDto;
import org.attrition.node.processes.http.api.game.dto.TickResponseDto;
import org.attrition.node.spi.ServiceRegistry;

/**
 * Status of the game loop and manual ticks.
 */
public class GameLoopController extends AbstractController {

    private final GameLoopService gameLoop;

    public GameLoopController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.gameLoop = registry.get(GameEngine.class).getGameLoop();
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(basePath + "game-loop/status", this::getStatus);
        app.post(basePath + "game-loop/tick", this::handleTick);
        GameApiExceptions.register(app);
    }

    @OpenApi(
        path = "game-loop/status",
        methods = {HttpMethod.GET},
        summary = "Game loop state, last tick and metrics",
        tags = {"game / loop"},
        responses = {@OpenApiResponse(status = "200", content = @OpenApiContent(from = GameLoopStatusDto.class))}
    )
    void getStatus(final Context ctx) {
        ctx.status(HttpStatus.OK).json(GameLoopStatusDto.from(gameLoop.getServiceStatus(), gameLoop.getIntervalMs(),
            gameLoop.getLastSummary()));
    }

    @OpenApi(
        path = "game-loop/tick",
        methods = {HttpMethod.POST},
        summary = "Run one tick synchronously",
        tags = {"game / loop"},
        responses = {@OpenApiResponse(status = "200", content = @OpenApiContent(from = TickResponseDto.class))}
    )
    void handleTick(final Context ctx) {
        ctx.status(HttpStatus.OK).json(TickResponseDto.from(gameLoop.runOnce()));
    }
}
