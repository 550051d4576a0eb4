package org.attrition.engine.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Uniform view of an in-flight record or queue entry, as reported to callers.
 *
 * @param id          record or entry id
 * @param queueType   owning queue
 * @param coord       base coordinate
 * @param catalogKey  catalog key
 * @param level       target level
 * @param quantity    units to build, 1 otherwise
 * @param status      {@code queued}, {@code active}, {@code completed}, ...
 * @param creditsCost cost of the change
 * @param identityKey identity key
 * @param startedAt   start instant, or {@code null}
 * @param completesAt completion instant, or {@code null}
 */
public record QueueItem(long id, QueueType queueType, String coord, String catalogKey, int level, int quantity,
                        String status, long creditsCost, String identityKey, Instant startedAt, Instant completesAt) {

    public static QueueItem of(BaseRecord record) {
        String status;
        if (record.active()) {
            status = QueueStatus.COMPLETED.wireName();
        } else if (record.started()) {
            status = QueueStatus.ACTIVE.wireName();
        } else {
            status = QueueStatus.QUEUED.wireName();
        }
        return new QueueItem(record.id(), record.kind().queueType(), record.coord(), record.catalogKey(),
            record.active() ? record.level() : record.targetLevel(), 1, status, record.creditsCost(),
            record.identityKey(), record.constructionStarted(), record.constructionCompleted());
    }

    public static QueueItem of(QueueEntry entry) {
        return new QueueItem(entry.id(), entry.type(), entry.coord(), entry.catalogKey(), entry.level(),
            entry.quantity(), entry.status().wireName(), entry.creditsCost(), entry.identityKey(),
            entry.startedAt(), entry.completesAt());
    }

    /**
     * @return scheduled duration in seconds, or {@code null} while not started
     */
    public Long etaSeconds() {
        if (startedAt == null || completesAt == null) {
            return null;
        }
        return Duration.between(startedAt, completesAt).getSeconds();
    }

    /**
     * @return whole seconds left until completion at {@code now}, at least 0, or {@code null}
     *         while not started
     */
    public Long remainingSeconds(Instant now) {
        if (startedAt == null || completesAt == null) {
            return null;
        }
        return Math.max(0L, Duration.between(now, completesAt).getSeconds());
    }
}
