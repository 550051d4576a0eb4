package org.attrition.engine.admission;

import org.attrition.engine.ledger.QueuedEnergyItem;
import org.attrition.engine.model.BaseRecord;
import org.attrition.engine.model.QueueItem;
import org.attrition.engine.model.QueueType;
import org.attrition.engine.model.RecordKind;

import java.util.Optional;

/**
 * Admission for record-backed queues. A first admission inserts an inactive level-0 record,
 * later ones turn an idle record into a pending upgrade. Nothing is charged here; the lane
 * is scheduled right after the write and the scheduler debits when it starts the record.
 */
public abstract class RecordAdmissionPipeline extends QueueAdmissionPipeline {

    private final RecordKind kind;

    protected RecordAdmissionPipeline(QueueType type, AdmissionDependencies deps) {
        super(type, deps);
        this.kind = type.recordKind();
    }

    private Optional<BaseRecord> existing(AdmissionContext context) {
        return context.records().stream()
            .filter(r -> r.kind() == kind && r.catalogKey().equals(context.spec().key()))
            .findFirst();
    }

    @Override
    protected void plan(AdmissionContext context) {
        int target = existing(context).map(BaseRecord::targetLevel).orElse(1);
        context.setTargetLevel(target);
        context.setCreditsCost(deps.catalog().costForLevel(getQueueType(), context.spec(), target));
    }

    @Override
    protected boolean isSameItem(QueuedEnergyItem item, AdmissionContext context) {
        return item.kind() == kind && item.catalogKey().equals(context.spec().key());
    }

    @Override
    protected long energyDelta(AdmissionContext context) {
        return deps.ledger().energyStep(context.location(), kind, context.spec().key());
    }

    @Override
    protected AdmissionResult persist(AdmissionContext context) {
        String empireId = context.empire().id();
        String coord = context.location().coord();
        String key = context.spec().key();
        Optional<BaseRecord> existing = existing(context);

        BaseRecord written = deps.identityGuard().admit(getQueueType(), context.identityKey(), key,
            () -> deps.store().findRecord(empireId, coord, kind, key)
                .filter(BaseRecord::inFlight)
                .map(QueueItem::of),
            () -> existing.isPresent()
                ? deps.store().beginUpgrade(existing.get().id(), context.creditsCost(), context.identityKey())
                : deps.store().insertConstruction(kind, empireId, coord, key, context.creditsCost(),
                    context.identityKey()));

        deps.scheduler().scheduleNext(empireId, coord, kind);
        BaseRecord current = deps.store().findRecord(written.id()).orElse(written);

        int minutes = Eta.minutes(context.creditsCost(), context.capacity().value());
        String state = current.started() ? "started" : "queued";
        String message = context.spec().displayName() + " construction " + state + ". " + etaText(minutes);
        return new AdmissionResult(QueueItem.of(current), minutes, context.capacity().value(), message,
            context.energy());
    }
}
