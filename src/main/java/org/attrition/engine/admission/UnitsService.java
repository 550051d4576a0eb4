package org.attrition.engine.admission;

import org.attrition.engine.capacity.CapacityResult;
import org.attrition.engine.catalog.StructureKey;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.model.QueueEntry;
import org.attrition.engine.model.QueueItem;
import org.attrition.engine.model.QueueType;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unit admission. Units are paid up front: the entry is written as pending, debited and
 * activated. A lost debit cancels the entry.
 */
public class UnitsService extends QueueAdmissionPipeline {

    public UnitsService(AdmissionDependencies deps) {
        super(QueueType.UNITS, deps);
    }

    @Override
    protected void plan(AdmissionContext context) {
        context.setTargetLevel(1);
        long unitCost = deps.catalog().costForLevel(QueueType.UNITS, context.spec(), 1);
        context.setCreditsCost(unitCost * context.quantity());
    }

    @Override
    protected CapacityResult capacityRate(AdmissionContext context) {
        return deps.capacityService().production(context.empire(), context.location(), context.records());
    }

    @Override
    protected String capacityName() {
        return "production";
    }

    @Override
    protected void checkCapacity(AdmissionContext context) {
        int required = context.spec().requiredBuildingLevel();
        int shipyards = deps.ledger().structureLevel(context.records(), StructureKey.SHIPYARDS);
        if (shipyards < required) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("requiredShipyardLevel", required);
            details.put("currentShipyardLevel", shipyards);
            throw new GameException(ErrorCode.INSUFFICIENT_SHIPYARD,
                "Requires Shipyard level " + required + " at this base (current " + shipyards + ").", details);
        }
        if (context.empire().credits() < context.creditsCost()) {
            throw insufficientCredits(context.creditsCost(), context.empire().credits());
        }
    }

    @Override
    protected AdmissionResult persist(AdmissionContext context) {
        String empireId = context.empire().id();
        long cost = context.creditsCost();
        QueueEntry entry = deps.identityGuard().admit(QueueType.UNITS, context.identityKey(),
            context.spec().key(),
            () -> deps.store().findLiveEntry(context.identityKey()).map(QueueItem::of),
            () -> deps.store().insertEntry(QueueType.UNITS, empireId, context.location().coord(),
                context.spec().key(), 1, context.quantity(), context.identityKey(), cost, context.now()));

        if (!deps.store().debitCredits(empireId, cost)) {
            deps.store().cancelEntry(entry.id());
            long available = deps.store().findEmpire(empireId).map(e -> e.credits()).orElse(0L);
            throw insufficientCredits(cost, available);
        }

        int minutes = Eta.minutes(cost, context.capacity().value());
        Instant now = deps.clock().instant();
        if (!deps.store().activateEntry(entry.id(), now, now.plus(minutes, ChronoUnit.MINUTES))) {
            deps.store().addCredits(empireId, cost);
            log.debug("[{}.start] entry {} left pending before activation, refunded {}", serviceName(),
                entry.id(), cost);
        }

        QueueEntry current = deps.store().findEntry(entry.id()).orElse(entry);
        String message = context.quantity() + " x " + context.spec().displayName() + " production started. "
            + etaText(minutes);
        return new AdmissionResult(QueueItem.of(current), minutes, context.capacity().value(), message,
            context.energy());
    }

    private static GameException insufficientCredits(long required, long available) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requiredCredits", required);
        details.put("availableCredits", available);
        details.put("shortfall", Math.max(0, required - available));
        return new GameException(ErrorCode.INSUFFICIENT_RESOURCES, "Insufficient credits.", details);
    }
}
