package org.attrition.engine.scheduling;

import org.attrition.engine.api.store.IGameStore;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.model.BaseRecord;
import org.attrition.engine.model.QueueEntry;
import org.attrition.engine.model.QueueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Cancels in-flight items and refunds what was charged.
 * <p>
 * Only credits that were actually debited come back: unstarted constructions and
 * uncharged research refund nothing. Cancelling something that is no longer in flight
 * is a no-op with a zero refund.
 */
public class CancellationService {

    private static final Logger log = LoggerFactory.getLogger(CancellationService.class);

    private final IGameStore store;
    private final ConstructionScheduler scheduler;

    public CancellationService(IGameStore store, ConstructionScheduler scheduler) {
        this.store = store;
        this.scheduler = scheduler;
    }

    /**
     * @throws GameException {@code NOT_FOUND} if no such item exists in the queue,
     *                       {@code NOT_OWNER} if it belongs to another empire
     */
    public CancelResult cancel(QueueType type, String empireId, long id) {
        return type.isRecordBacked() ? cancelRecord(type, empireId, id) : cancelEntry(type, empireId, id);
    }

    private CancelResult cancelRecord(QueueType type, String empireId, long id) {
        BaseRecord record = store.findRecord(id)
            .filter(r -> r.kind() == type.recordKind())
            .orElseThrow(() -> GameException.notFound(type.wireName() + " item", String.valueOf(id)));
        requireOwner(record.empireId(), empireId, id);

        Optional<BaseRecord> cancelled = store.cancelRecord(id);
        if (cancelled.isEmpty()) {
            log.debug("[Cancel] {} {} has nothing in flight", type.wireName(), id);
            return CancelResult.nothingInFlight(id);
        }
        BaseRecord before = cancelled.get();
        long refunded = before.started() ? before.creditsCost() : 0;
        CancelResult result = new CancelResult(id, before.pendingUpgrade(), !before.pendingUpgrade(), refunded);
        log.info("[Cancel] {} key={} base={} revertedUpgrade={} deleted={} refundedCredits={}",
            type.wireName(), before.catalogKey(), before.coord(), result.revertedUpgrade(), result.deleted(), refunded);

        scheduler.scheduleNext(before.empireId(), before.coord(), before.kind());
        return result;
    }

    private CancelResult cancelEntry(QueueType type, String empireId, long id) {
        QueueEntry entry = store.findEntry(id)
            .filter(e -> e.type() == type)
            .orElseThrow(() -> GameException.notFound(type.wireName() + " item", String.valueOf(id)));
        requireOwner(entry.empireId(), empireId, id);

        Optional<QueueEntry> cancelled = store.cancelEntry(id);
        if (cancelled.isEmpty()) {
            log.debug("[Cancel] {} {} is already {}", type.wireName(), id, entry.status().wireName());
            return CancelResult.nothingInFlight(id);
        }
        QueueEntry before = cancelled.get();
        long refunded = before.charged() ? before.creditsCost() : 0;
        log.info("[Cancel] {} key={} base={} refundedCredits={}", type.wireName(), before.catalogKey(), before.coord(), refunded);
        return new CancelResult(id, false, false, refunded);
    }

    private static void requireOwner(String ownerId, String empireId, long id) {
        if (!ownerId.equals(empireId)) {
            throw new GameException(ErrorCode.NOT_OWNER, "Item " + id + " does not belong to this empire.");
        }
    }
}
