package org.attrition.node.processes.http.api.game;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiResponse;
import org.attrition.engine.GameEngine;
import org.attrition.node.processes.http.AbstractController;
import org.attrition.node.processes.http.api.game.dto.BaseQueueDto;
import org.attrition.node.processes.http.api.game.dto.BaseStatsDto;
import org.attrition.node.processes.http.api.game.dto.EmpireDto;
import org.attrition.node.processes.http.api.game.dto.ErrorResponseDto;
import org.attrition.node.spi.ServiceRegistry;

/**
 * Read-only views of the caller's bases and empire.
 */
public class BaseStatusController extends AbstractController {

    private final GameEngine engine;

    public BaseStatusController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.engine = registry.get(GameEngine.class);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(basePath + "bases/{coord}/stats", this::getBaseStats);
        app.get(basePath + "bases/{coord}/queue", this::getBaseQueue);
        app.get(basePath + "empire", this::getEmpire);
        GameApiExceptions.register(app);
    }

    @OpenApi(
        path = "bases/{coord}/stats",
        methods = {HttpMethod.GET},
        summary = "Energy, area, population and capacities of a base",
        tags = {"game / status"},
        pathParams = {@OpenApiParam(name = "coord", description = "Base coordinate", required = true)},
        responses = {
            @OpenApiResponse(status = "200", content = @OpenApiContent(from = BaseStatsDto.class)),
            @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponseDto.class))
        }
    )
    void getBaseStats(final Context ctx) {
        final String empireId = GameApiExceptions.empireId(ctx);
        ctx.status(HttpStatus.OK).json(BaseStatsDto.from(engine.getStatus().baseStats(empireId, ctx.pathParam("coord"))));
    }

    @OpenApi(
        path = "bases/{coord}/queue",
        methods = {HttpMethod.GET},
        summary = "In-flight items of a base with their energy projection",
        tags = {"game / status"},
        pathParams = {@OpenApiParam(name = "coord", description = "Base coordinate", required = true)},
        responses = {
            @OpenApiResponse(status = "200", content = @OpenApiContent(from = BaseQueueDto.class)),
            @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponseDto.class))
        }
    )
    void getBaseQueue(final Context ctx) {
        final String empireId = GameApiExceptions.empireId(ctx);
        final String coord = ctx.pathParam("coord");
        ctx.status(HttpStatus.OK).json(BaseQueueDto.from(coord, engine.getStatus().baseQueue(empireId, coord)));
    }

    @OpenApi(
        path = "empire",
        methods = {HttpMethod.GET},
        summary = "Credits, tech levels, units and income of the caller's empire",
        tags = {"game / status"},
        responses = {
            @OpenApiResponse(status = "200", content = @OpenApiContent(from = EmpireDto.class)),
            @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponseDto.class))
        }
    )
    void getEmpire(final Context ctx) {
        final String empireId = GameApiExceptions.empireId(ctx);
        ctx.status(HttpStatus.OK).json(EmpireDto.from(engine.getStatus().empireView(empireId)));
    }
}
