package org.attrition.node.processes.http.api.game;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiRequestBody;
import io.javalin.openapi.OpenApiResponse;
import org.attrition.engine.GameEngine;
import org.attrition.engine.admission.AdmissionResult;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.model.QueueType;
import org.attrition.engine.scheduling.CancelResult;
import org.attrition.node.processes.http.AbstractController;
import org.attrition.node.processes.http.api.game.dto.AdmissionResponseDto;
import org.attrition.node.processes.http.api.game.dto.CancelResponseDto;
import org.attrition.node.processes.http.api.game.dto.ErrorResponseDto;
import org.attrition.node.processes.http.api.game.dto.StartRequestDto;
import org.attrition.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Start and cancel endpoints of the four queues. The acting empire comes from the
 * {@code X-Empire-Id} header.
 */
public class QueueController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueueController.class);

    private final GameEngine engine;

    public QueueController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.engine = registry.get(GameEngine.class);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.post(basePath + "{queue}/start", this::handleStart);
        app.post(basePath + "{queue}/{id}/cancel", this::handleCancel);
        GameApiExceptions.register(app);
    }

    @OpenApi(
        path = "{queue}/start",
        methods = {HttpMethod.POST},
        summary = "Queue a structure, defense, research or unit",
        tags = {"game / queues"},
        pathParams = {
            @OpenApiParam(name = "queue", description = "structures, defenses, research or units", required = true)
        },
        requestBody = @OpenApiRequestBody(content = @OpenApiContent(from = StartRequestDto.class)),
        responses = {
            @OpenApiResponse(status = "200", content = @OpenApiContent(from = AdmissionResponseDto.class)),
            @OpenApiResponse(status = "400", description = "Admission check failed",
                content = @OpenApiContent(from = ErrorResponseDto.class)),
            @OpenApiResponse(status = "404", description = "Base or empire not found, or not owned",
                content = @OpenApiContent(from = ErrorResponseDto.class)),
            @OpenApiResponse(status = "409", description = "Same item already in progress",
                content = @OpenApiContent(from = ErrorResponseDto.class))
        }
    )
    void handleStart(final Context ctx) {
        final QueueType type = queueType(ctx);
        final String empireId = GameApiExceptions.empireId(ctx);
        final StartRequestDto body = parseBody(ctx);
        LOGGER.debug("Start {} empire={} body={}", type.wireName(), empireId, body);
        final AdmissionResult result = engine.getAdmissions().start(type, empireId, body.toRequest());
        ctx.status(HttpStatus.OK).json(AdmissionResponseDto.from(result));
    }

    @OpenApi(
        path = "{queue}/{id}/cancel",
        methods = {HttpMethod.POST},
        summary = "Cancel a queued or running item",
        tags = {"game / queues"},
        pathParams = {
            @OpenApiParam(name = "queue", description = "structures, defenses, research or units", required = true),
            @OpenApiParam(name = "id", description = "Item id", required = true)
        },
        responses = {
            @OpenApiResponse(status = "200", content = @OpenApiContent(from = CancelResponseDto.class)),
            @OpenApiResponse(status = "404", description = "Item not found or not owned",
                content = @OpenApiContent(from = ErrorResponseDto.class))
        }
    )
    void handleCancel(final Context ctx) {
        final QueueType type = queueType(ctx);
        final String empireId = GameApiExceptions.empireId(ctx);
        final long id;
        try {
            id = Long.parseLong(ctx.pathParam("id"));
        } catch (final NumberFormatException e) {
            throw GameException.invalidField("id", "id must be numeric.");
        }
        final CancelResult result = engine.getCancellation().cancel(type, empireId, id);
        ctx.status(HttpStatus.OK).json(CancelResponseDto.from(result));
    }

    private static QueueType queueType(final Context ctx) {
        final String queue = ctx.pathParam("queue");
        return QueueType.fromWireName(queue)
            .orElseThrow(() -> new GameException(ErrorCode.NOT_FOUND, "Unknown queue: " + queue));
    }

    private static StartRequestDto parseBody(final Context ctx) {
        if (ctx.body().isBlank()) {
            throw GameException.invalidField("body", "Request body is required.");
        }
        try {
            return ctx.bodyAsClass(StartRequestDto.class);
        } catch (final Exception e) {
            LOGGER.debug("Unreadable start request: {}", e.getMessage());
            throw GameException.invalidField("body", "Request body is not valid JSON.");
        }
    }
}
