package org.attrition.node.processes.http.api.game;

import io.javalin.Javalin;
import io.javalin.http.Context;
import org.attrition.engine.api.store.StoreException;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.node.processes.http.api.game.dto.ErrorResponseDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exception handlers and request helpers shared by the game controllers.
 */
final class GameApiExceptions {

    static final String EMPIRE_HEADER = "X-Empire-Id";

    private static final Logger LOGGER = LoggerFactory.getLogger(GameApiExceptions.class);

    private GameApiExceptions() {
    }

    static void register(final Javalin app) {
        app.exception(GameException.class, (e, ctx) -> {
            LOGGER.debug("Request {} {} failed: {} {}", ctx.method(), ctx.path(), e.getCode(), e.getMessage());
            respond(ctx, ErrorResponseDto.of(e.getCode(), e.getMessage(), e.getDetails()));
        });
        app.exception(StoreException.class, (e, ctx) -> {
            LOGGER.warn("Storage failure for request {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            LOGGER.debug("Storage failure details:", e);
            respond(ctx, ErrorResponseDto.of(ErrorCode.DB_ERROR, "A storage error occurred.", null));
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            LOGGER.debug("Unhandled exception details:", e);
            respond(ctx, ErrorResponseDto.of(ErrorCode.INTERNAL_ERROR, "An internal server error occurred.", null));
        });
    }

    private static void respond(final Context ctx, final ErrorResponseDto body) {
        ctx.status(body.status()).json(body);
    }

    static String empireId(final Context ctx) {
        final String empireId = ctx.header(EMPIRE_HEADER);
        if (empireId == null || empireId.isBlank()) {
            throw GameException.invalidField(EMPIRE_HEADER, EMPIRE_HEADER + " header is required.");
        }
        return empireId.trim();
    }
}
