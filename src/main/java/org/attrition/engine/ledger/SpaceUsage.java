package org.attrition.engine.ledger;

/**
 * Area or population of a base.
 *
 * @param capacity capacity from the environment and effectively active records
 * @param used     consumed by effectively active records
 * @param reserved one step for every in-flight change
 * @param pendingGain capacity the in-flight changes will add once active
 */
public record SpaceUsage(long capacity, long used, long reserved, long pendingGain) {

    public long free() {
        return capacity - used;
    }

    /**
     * Free space once every earlier in-flight change has completed.
     */
    public long projectedFree() {
        return capacity + pendingGain - used - reserved;
    }
}
