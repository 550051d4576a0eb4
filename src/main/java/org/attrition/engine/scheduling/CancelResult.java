package org.attrition.engine.scheduling;

/**
 * Outcome of a cancellation.
 *
 * @param cancelledId     id of the record or entry
 * @param revertedUpgrade whether an upgrade reverted to its previous level
 * @param deleted         whether a first construction was removed
 * @param refundedCredits credits returned to the empire
 */
public record CancelResult(long cancelledId, boolean revertedUpgrade, boolean deleted, long refundedCredits) {

    public static CancelResult nothingInFlight(long id) {
        return new CancelResult(id, false, false, 0);
    }
}
