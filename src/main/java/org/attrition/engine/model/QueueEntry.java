package org.attrition.engine.model;

import java.time.Instant;

/**
 * A research or unit queue entry.
 *
 * @param id          store id
 * @param type        {@link QueueType#RESEARCH} or {@link QueueType#UNITS}
 * @param empireId    owning empire
 * @param coord       base coordinate
 * @param catalogKey  tech or unit key
 * @param level       target tech level (1 for units)
 * @param quantity    units to build (1 for research)
 * @param identityKey identity key
 * @param status      lifecycle status
 * @param charged     whether credits were debited
 * @param creditsCost total cost
 * @param createdAt   admission instant
 * @param startedAt   activation instant, or {@code null}
 * @param completesAt completion instant, or {@code null} while not active
 */
public record QueueEntry(long id, QueueType type, String empireId, String coord, String catalogKey,
                         int level, int quantity, String identityKey, QueueStatus status, boolean charged,
                         long creditsCost, Instant createdAt, Instant startedAt, Instant completesAt) {
}
