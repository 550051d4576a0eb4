package org.attrition.node.processes.http.api.game.dto;

import org.attrition.engine.admission.AdmissionResult;

import java.util.Map;

/**
 * Response of a successful {@code {queue}/start}.
 */
public record AdmissionResponseDto(
    boolean success,
    String message,
    QueueItemDto queueItem,
    int etaMinutes,
    double capacityPerHour,
    Map<String, Object> energy
) {
    public static AdmissionResponseDto from(final AdmissionResult result) {
        return new AdmissionResponseDto(true, result.message(), QueueItemDto.from(result.queueItem()),
            result.etaMinutes(), result.capacityPerHour(), result.energy().toDetails());
    }
}
