package org.attrition.engine.services.gameloop;

import org.attrition.engine.admission.Eta;
import org.attrition.engine.api.store.IGameStore;
import org.attrition.engine.capacity.CapacityResult;
import org.attrition.engine.capacity.CapacityService;
import org.attrition.engine.economy.EconomyService;
import org.attrition.engine.model.BaseRecord;
import org.attrition.engine.model.Empire;
import org.attrition.engine.model.Location;
import org.attrition.engine.model.QueueEntry;
import org.attrition.engine.model.QueueType;
import org.attrition.engine.scheduling.ConstructionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * One pass of the game loop. Every step is a conditional update in the store, so running a
 * tick twice, or concurrently with a manual tick, applies each transition once.
 * <p>
 * Phases, in order: activate waiting research, complete due research, complete due units,
 * complete due structure and defense records, schedule idle lanes, accrue income. A failing
 * item is logged, counted and recorded; the scan continues with the next one.
 */
public class TickProcessor {

    /**
     * Receives transient per-item failures.
     */
    @FunctionalInterface
    public interface ErrorRecorder {
        void record(String code, String message, String details);
    }

    private static final Logger log = LoggerFactory.getLogger(TickProcessor.class);

    private final IGameStore store;
    private final CapacityService capacityService;
    private final ConstructionScheduler scheduler;
    private final EconomyService economy;
    private final Clock clock;
    private final Duration pendingGrace;

    public TickProcessor(IGameStore store, CapacityService capacityService, ConstructionScheduler scheduler,
                         EconomyService economy, Clock clock, Duration pendingGrace) {
        this.store = store;
        this.capacityService = capacityService;
        this.scheduler = scheduler;
        this.economy = economy;
        this.clock = clock;
        this.pendingGrace = pendingGrace;
    }

    public TickSummary tick() {
        return tick((code, message, details) -> { });
    }

    public TickSummary tick(ErrorRecorder recorder) {
        long startNanos = System.nanoTime();
        TickSummary summary = new TickSummary();
        Instant now = clock.instant();

        phase("activateResearch", recorder, () -> activateResearch(now, summary, recorder));
        phase("completeResearch", recorder, () -> completeResearch(now, summary, recorder));
        phase("completeUnits", recorder, () -> completeUnits(now, summary, recorder));
        phase("completeRecords", recorder, () -> completeRecords(now, summary, recorder));
        phase("scheduleLanes", recorder, () -> scheduleLanes(summary, recorder));
        phase("accrueIncome", recorder, () -> accrueIncome(now, summary, recorder));

        summary.setDurationMs((System.nanoTime() - startNanos) / 1_000_000);
        logSummary(summary);
        return summary;
    }

    private void activateResearch(Instant now, TickSummary summary, ErrorRecorder recorder) {
        for (QueueEntry entry : store.findAwaitingActivation(QueueType.RESEARCH, now.minus(pendingGrace))) {
            item(QueueType.RESEARCH, "activate research", entry.id(), summary, recorder, () -> {
                Optional<Empire> empire = store.findEmpire(entry.empireId());
                Optional<Location> location = store.findLocation(entry.coord());
                if (empire.isEmpty() || location.isEmpty()) {
                    return;
                }
                if (empire.get().credits() < entry.creditsCost()) {
                    log.debug("[GameLoop] tech waiting for credits techKey={} location={} needed={} available={}",
                        entry.catalogKey(), entry.coord(), entry.creditsCost(), empire.get().credits());
                    return;
                }
                List<BaseRecord> records = store.findRecords(entry.empireId(), entry.coord());
                CapacityResult rate = capacityService.research(empire.get(), location.get(), records);
                if (rate.value() <= 0) {
                    return;
                }
                if (!store.debitCredits(entry.empireId(), entry.creditsCost())) {
                    return;
                }
                int minutes = Eta.minutes(entry.creditsCost(), rate.value());
                Instant startedAt = clock.instant();
                if (store.activateEntry(entry.id(), startedAt, startedAt.plus(minutes, ChronoUnit.MINUTES))) {
                    summary.activated(QueueType.RESEARCH);
                    log.info("[GameLoop] tech activated techKey={} location={} level={} cost={} etaMinutes={}",
                        entry.catalogKey(), entry.coord(), entry.level(), entry.creditsCost(), minutes);
                } else {
                    store.addCredits(entry.empireId(), entry.creditsCost());
                }
            });
        }
    }

    private void completeResearch(Instant now, TickSummary summary, ErrorRecorder recorder) {
        for (QueueEntry entry : store.findDueEntries(QueueType.RESEARCH, now)) {
            item(QueueType.RESEARCH, "complete research", entry.id(), summary, recorder, () -> {
                if (store.findEmpire(entry.empireId()).isEmpty()) {
                    if (store.cancelEntry(entry.id()).isPresent()) {
                        summary.cancelled(QueueType.RESEARCH);
                        log.warn("[GameLoop] tech cancel missingEmpire techKey={} location={}",
                            entry.catalogKey(), entry.coord());
                    }
                    return;
                }
                if (store.completeResearch(entry.id())) {
                    summary.completed(QueueType.RESEARCH);
                    log.debug("[GameLoop] tech completed techKey={} location={} level={}",
                        entry.catalogKey(), entry.coord(), entry.level());
                }
            });
        }
    }

    private void completeUnits(Instant now, TickSummary summary, ErrorRecorder recorder) {
        for (QueueEntry entry : store.findDueEntries(QueueType.UNITS, now)) {
            item(QueueType.UNITS, "complete units", entry.id(), summary, recorder, () -> {
                if (store.findEmpire(entry.empireId()).isEmpty()) {
                    if (store.cancelEntry(entry.id()).isPresent()) {
                        summary.cancelled(QueueType.UNITS);
                        log.warn("[GameLoop] unit cancel missingEmpire unitKey={} location={}",
                            entry.catalogKey(), entry.coord());
                    }
                    return;
                }
                if (store.completeUnits(entry.id())) {
                    summary.completed(QueueType.UNITS);
                    log.debug("[GameLoop] units completed unitKey={} location={} quantity={}",
                        entry.catalogKey(), entry.coord(), entry.quantity());
                }
            });
        }
    }

    private void completeRecords(Instant now, TickSummary summary, ErrorRecorder recorder) {
        for (BaseRecord record : store.findDueRecords(now)) {
            QueueType type = record.kind().queueType();
            item(type, "complete record", record.id(), summary, recorder, () -> {
                if (store.completeRecord(record)) {
                    summary.completed(type);
                    log.debug("[GameLoop] record completed key={} location={} level={}",
                        record.catalogKey(), record.coord(), record.targetLevel());
                }
            });
        }
    }

    private void scheduleLanes(TickSummary summary, ErrorRecorder recorder) {
        for (IGameStore.LaneKey lane : store.findLanesWithUnscheduled()) {
            QueueType type = lane.kind().queueType();
            String laneId = lane.empireId() + ":" + lane.coord() + ":" + lane.kind();
            item(type, "schedule lane", laneId, summary, recorder, () -> {
                if (scheduler.scheduleNext(lane.empireId(), lane.coord(), lane.kind()).isPresent()) {
                    summary.scheduled(type);
                }
            });
        }
    }

    private void accrueIncome(Instant now, TickSummary summary, ErrorRecorder recorder) {
        for (Empire empire : store.listEmpires()) {
            try {
                if (economy.accrue(empire, now)) {
                    summary.incomeUpdated();
                }
            } catch (RuntimeException e) {
                summary.incomeError();
                log.warn("[GameLoop] income accrual failed empire={}: {}", empire.id(), e.getMessage());
                log.debug("Income accrual failure details:", e);
                recorder.record("TICK_INCOME_FAILED", "Income accrual failed for " + empire.id(), e.getMessage());
            }
        }
    }

    private void item(QueueType type, String action, Object id, TickSummary summary, ErrorRecorder recorder,
                      Runnable body) {
        try {
            body.run();
        } catch (RuntimeException e) {
            summary.error(type);
            log.warn("[GameLoop] {} failed queue={} id={}: {}", action, type.wireName(), id, e.getMessage());
            log.debug("Tick item failure details:", e);
            recorder.record("TICK_ITEM_FAILED", action + " failed for " + type.wireName() + " " + id,
                e.getMessage());
        }
    }

    private void phase(String name, ErrorRecorder recorder, Runnable body) {
        try {
            body.run();
        } catch (RuntimeException e) {
            log.warn("[GameLoop] phase {} failed: {}", name, e.getMessage());
            log.debug("Tick phase failure details:", e);
            recorder.record("TICK_PHASE_FAILED", "Phase " + name + " failed", e.getMessage());
        }
    }

    private void logSummary(TickSummary summary) {
        TickSummary.Counters research = summary.get(QueueType.RESEARCH);
        TickSummary.Counters units = summary.get(QueueType.UNITS);
        TickSummary.Counters structures = summary.get(QueueType.STRUCTURES);
        TickSummary.Counters defenses = summary.get(QueueType.DEFENSES);
        Object[] args = {
            research.getActivated(), research.getCompleted(), research.getCancelled(), research.getErrors(),
            units.getCompleted(), units.getCancelled(), units.getErrors(),
            structures.getCompleted(), structures.getScheduled(), structures.getErrors(),
            defenses.getCompleted(), defenses.getScheduled(), defenses.getErrors(),
            summary.getIncomeUpdates(), summary.getDurationMs()
        };
        String format = "[GameLoop] tick summary researchActivated={} researchCompleted={} researchCancelled={} "
            + "researchErrors={} unitsCompleted={} unitsCancelled={} unitsErrors={} structuresCompleted={} "
            + "structuresScheduled={} structuresErrors={} defensesCompleted={} defensesScheduled={} "
            + "defensesErrors={} incomeUpdates={} durationMs={}";
        if (summary.hasActivity()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
