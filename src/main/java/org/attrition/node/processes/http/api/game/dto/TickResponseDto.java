package org.attrition.node.processes.http.api.game.dto;

import org.attrition.engine.services.gameloop.TickSummary;

import java.util.Map;

/**
 * Response of {@code game-loop/tick}.
 */
public record TickResponseDto(boolean success, Map<String, Number> summary) {

    public static TickResponseDto from(final TickSummary summary) {
        return new TickResponseDto(true, summary.toMap());
    }
}
