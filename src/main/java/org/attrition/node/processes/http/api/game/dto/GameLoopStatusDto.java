package org.attrition.node.processes.http.api.game.dto;

import org.attrition.engine.api.resources.OperationalError;
import org.attrition.engine.api.services.ServiceStatus;
import org.attrition.engine.services.gameloop.TickSummary;

import java.util.List;
import java.util.Map;

/**
 * Response of {@code game-loop/status}.
 *
 * @param state      service state
 * @param healthy    whether no errors were recorded
 * @param intervalMs pause between ticks
 * @param lastTick   counters of the most recent tick, {@code null} before the first
 * @param metrics    cumulative counters
 * @param errors     recorded error messages, oldest first
 */
public record GameLoopStatusDto(
    String state,
    boolean healthy,
    long intervalMs,
    Map<String, Number> lastTick,
    Map<String, Number> metrics,
    List<String> errors
) {
    public static GameLoopStatusDto from(final ServiceStatus status, final long intervalMs, final TickSummary lastTick) {
        return new GameLoopStatusDto(status.state().name(), status.healthy(), intervalMs,
            lastTick == null ? null : lastTick.toMap(), status.metrics(),
            status.errors().stream().map(OperationalError::message).toList());
    }
}
