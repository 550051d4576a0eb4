package org.attrition.engine.admission;

import org.attrition.engine.capacity.CapacityResult;
import org.attrition.engine.catalog.StructureKey;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.model.QueueEntry;
import org.attrition.engine.model.QueueItem;
import org.attrition.engine.model.QueueStatus;
import org.attrition.engine.model.QueueType;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Research admission. The entry is written as pending and activated right away when the
 * empire can pay; otherwise it waits as queued and the game loop activates it later.
 */
public class ResearchService extends QueueAdmissionPipeline {

    public ResearchService(AdmissionDependencies deps) {
        super(QueueType.RESEARCH, deps);
    }

    /**
     * Next level above both the researched level and any live entry for the same tech.
     */
    @Override
    protected void plan(AdmissionContext context) {
        String key = context.spec().key();
        int highestLive = deps.store().findLiveEntries(context.empire().id(), QueueType.RESEARCH).stream()
            .filter(e -> e.catalogKey().equals(key))
            .mapToInt(QueueEntry::level)
            .max()
            .orElse(0);
        int target = 1 + Math.max(context.empire().techLevel(key), highestLive);
        context.setTargetLevel(target);
        context.setCreditsCost(deps.catalog().costForLevel(QueueType.RESEARCH, context.spec(), target));
    }

    @Override
    protected CapacityResult capacityRate(AdmissionContext context) {
        return deps.capacityService().research(context.empire(), context.location(), context.records());
    }

    @Override
    protected String capacityName() {
        return "research";
    }

    @Override
    protected void checkCapacity(AdmissionContext context) {
        int required = context.spec().requiredBuildingLevel();
        int labs = deps.ledger().structureLevel(context.records(), StructureKey.RESEARCH_LABS);
        if (labs < required) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("requiredLabs", required);
            details.put("currentLabs", labs);
            throw new GameException(ErrorCode.INSUFFICIENT_LABS,
                "Requires Research Labs level " + required + " at this base (current " + labs + ").", details);
        }
    }

    @Override
    protected AdmissionResult persist(AdmissionContext context) {
        String empireId = context.empire().id();
        long cost = context.creditsCost();
        QueueEntry entry = deps.identityGuard().admit(QueueType.RESEARCH, context.identityKey(),
            context.spec().key(),
            () -> deps.store().findLiveEntry(context.identityKey()).map(QueueItem::of),
            () -> deps.store().insertEntry(QueueType.RESEARCH, empireId, context.location().coord(),
                context.spec().key(), context.targetLevel(), 1, context.identityKey(), cost, context.now()));

        int minutes = Eta.minutes(cost, context.capacity().value());
        boolean started = false;
        if (context.empire().credits() >= cost && deps.store().debitCredits(empireId, cost)) {
            Instant now = deps.clock().instant();
            started = deps.store().activateEntry(entry.id(), now, now.plus(minutes, ChronoUnit.MINUTES));
            if (!started) {
                deps.store().addCredits(empireId, cost);
            }
        } else {
            deps.store().transitionEntry(entry.id(), QueueStatus.PENDING, QueueStatus.QUEUED);
        }

        QueueEntry current = deps.store().findEntry(entry.id()).orElse(entry);
        String message = started
            ? context.spec().displayName() + " research started. " + etaText(minutes)
            : context.spec().displayName() + " research queued until credits are available.";
        return new AdmissionResult(QueueItem.of(current), minutes, context.capacity().value(), message,
            context.energy());
    }
}
