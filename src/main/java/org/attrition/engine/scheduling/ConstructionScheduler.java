package org.attrition.engine.scheduling;

import org.attrition.engine.admission.Eta;
import org.attrition.engine.api.store.IGameStore;
import org.attrition.engine.capacity.CapacityResult;
import org.attrition.engine.capacity.CapacityService;
import org.attrition.engine.model.BaseRecord;
import org.attrition.engine.model.Empire;
import org.attrition.engine.model.Location;
import org.attrition.engine.model.RecordKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Starts the head of a base's construction lane once the empire can pay for it.
 * <p>
 * Each base has one lane per {@link RecordKind}. Structures run at the construction rate,
 * defenses at the citizen rate. Credits are debited here, never at admission. The debit
 * happens before the lane is claimed so that a concurrent cancellation can never refund
 * credits that were not taken.
 */
public class ConstructionScheduler {

    private static final Logger log = LoggerFactory.getLogger(ConstructionScheduler.class);

    private final IGameStore store;
    private final CapacityService capacityService;
    private final Clock clock;

    public ConstructionScheduler(IGameStore store, CapacityService capacityService, Clock clock) {
        this.store = store;
        this.capacityService = capacityService;
        this.clock = clock;
    }

    /**
     * @return the record that was started, or empty if the lane is busy, empty, or gated
     */
    public Optional<BaseRecord> scheduleNext(String empireId, String coord, RecordKind kind) {
        if (store.findInProgress(empireId, coord, kind).isPresent()) {
            return Optional.empty();
        }
        List<BaseRecord> queue = store.findUnscheduled(empireId, coord, kind);
        if (queue.isEmpty()) {
            return Optional.empty();
        }
        BaseRecord head = queue.get(0);

        Optional<Empire> empire = store.findEmpire(empireId);
        Optional<Location> location = store.findLocation(coord);
        if (empire.isEmpty() || location.isEmpty()) {
            log.debug("[Scheduler] skipping lane {}:{}:{}, empire or location missing", empireId, coord, kind);
            return Optional.empty();
        }
        if (empire.get().credits() < head.creditsCost()) {
            log.debug("[Scheduler] credits gating key={} base={} needed={} available={}",
                head.catalogKey(), coord, head.creditsCost(), empire.get().credits());
            return Optional.empty();
        }

        CapacityResult rate = laneRate(empire.get(), location.get(), kind);
        if (rate.value() <= 0) {
            log.debug("[Scheduler] no {} capacity at {}, key={} stays queued", kind, coord, head.catalogKey());
            return Optional.empty();
        }
        int minutes = Eta.minutes(head.creditsCost(), rate.value());

        if (!store.debitCredits(empireId, head.creditsCost())) {
            log.debug("[Scheduler] debit lost for key={} base={}", head.catalogKey(), coord);
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (!store.claimLane(head.id(), now, now.plus(minutes, ChronoUnit.MINUTES))) {
            store.addCredits(empireId, head.creditsCost());
            return Optional.empty();
        }
        log.info("[Scheduler] started key={} base={} level={} cost={} etaMinutes={} capacityPerHour={}",
            head.catalogKey(), coord, head.targetLevel(), head.creditsCost(), minutes, rate.value());
        return store.findRecord(head.id());
    }

    /**
     * Rate of the lane a record kind is built in.
     */
    public CapacityResult laneRate(Empire empire, Location location, RecordKind kind) {
        List<BaseRecord> records = store.findRecords(empire.id(), location.coord());
        return kind == RecordKind.STRUCTURE
            ? capacityService.construction(empire, location, records)
            : capacityService.citizen(records);
    }
}
