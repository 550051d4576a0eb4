package org.attrition.engine.model;

import java.time.Instant;

/**
 * One structure or defense at a base. While a change is in flight the record is inactive:
 * a first construction has level 0 and no pending upgrade, an upgrade keeps its current
 * level and has {@code pendingUpgrade} set.
 *
 * @param id                    store id
 * @param kind                  structure or defense
 * @param empireId              owning empire
 * @param coord                 base coordinate
 * @param catalogKey            catalog key
 * @param level                 completed level
 * @param active                whether the record is idle and in effect
 * @param pendingUpgrade        whether an upgrade of an existing level is in flight
 * @param creditsCost           cost of the in-flight change, 0 when idle
 * @param admissionOrder        monotonic admission order of the in-flight change
 * @param identityKey           identity key of the in-flight change
 * @param constructionStarted   when the scheduler started it, or {@code null}
 * @param constructionCompleted when it completes, or {@code null}
 * @param createdAt             first admission of this record
 */
public record BaseRecord(long id, RecordKind kind, String empireId, String coord, String catalogKey,
                         int level, boolean active, boolean pendingUpgrade, long creditsCost,
                         long admissionOrder, String identityKey, Instant constructionStarted,
                         Instant constructionCompleted, Instant createdAt) {

    public boolean inFlight() {
        return !active;
    }

    public boolean started() {
        return constructionStarted != null;
    }

    /**
     * Level the record counts at for energy, area, population and capacity: the current level
     * for active records and pending upgrades, nothing for a first construction.
     */
    public int effectiveLevel() {
        return active || pendingUpgrade ? level : 0;
    }

    public int targetLevel() {
        return level + 1;
    }
}
