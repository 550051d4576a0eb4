package org.attrition.node.processes.http.api.game.dto;

import org.attrition.engine.scheduling.CancelResult;

/**
 * Response of {@code {queue}/{id}/cancel}.
 */
public record CancelResponseDto(
    boolean success,
    String cancelledId,
    boolean revertedUpgrade,
    boolean deleted,
    long refundedCredits
) {
    public static CancelResponseDto from(final CancelResult result) {
        return new CancelResponseDto(true, String.valueOf(result.cancelledId()), result.revertedUpgrade(),
            result.deleted(), result.refundedCredits());
    }
}
