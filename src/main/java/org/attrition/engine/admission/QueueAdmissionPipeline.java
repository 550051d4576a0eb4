package org.attrition.engine.admission;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.attrition.engine.capacity.CapacityResult;
import org.attrition.engine.catalog.CatalogSpec;
import org.attrition.engine.catalog.TechPrereq;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.ledger.EnergyBalance;
import org.attrition.engine.ledger.QueuedEnergyItem;
import org.attrition.engine.model.BaseRecord;
import org.attrition.engine.model.Empire;
import org.attrition.engine.model.Location;
import org.attrition.engine.model.QueueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admission of one queue type. {@link #start} runs the checks in a fixed order and persists
 * only after all of them passed:
 * <ol>
 *     <li>request shape and catalog key</li>
 *     <li>empire and location exist, location owned by the empire</li>
 *     <li>tech prerequisites</li>
 *     <li>capacity rate, then the queue-specific capacity checks</li>
 *     <li>energy feasibility</li>
 *     <li>identity, as part of persisting</li>
 * </ol>
 * Subclasses plan the level and cost, add their capacity checks and persist.
 */
public abstract class QueueAdmissionPipeline {

    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final AdmissionDependencies deps;
    private final QueueType type;

    protected QueueAdmissionPipeline(QueueType type, AdmissionDependencies deps) {
        this.type = type;
        this.deps = deps;
    }

    public QueueType getQueueType() {
        return type;
    }

    /**
     * Admits a request for the given empire.
     *
     * @throws GameException describing the first failed check
     */
    public final AdmissionResult start(String empireId, AdmissionRequest request) {
        try {
            return admit(empireId, request);
        } catch (GameException e) {
            if (log.isDebugEnabled()) {
                log.debug("[{}.start] rejected code={} message={} details={}", serviceName(),
                    e.getCode(), e.getMessage(), GSON.toJson(e.getDetails()));
            }
            throw e;
        }
    }

    private AdmissionResult admit(String empireId, AdmissionRequest request) {
        CatalogSpec spec = validate(request);

        Empire empire = deps.store().findEmpire(empireId)
            .orElseThrow(() -> GameException.notFound("Empire", empireId));
        Location location = deps.store().findLocation(request.locationCoord())
            .orElseThrow(() -> GameException.notFound("Location", request.locationCoord()));
        if (!location.isOwnedBy(empireId)) {
            throw new GameException(ErrorCode.NOT_OWNER,
                "Location " + location.coord() + " is not owned by empire " + empireId + ".");
        }

        checkTech(empire, spec);

        List<BaseRecord> records = deps.store().findRecords(empireId, location.coord());
        AdmissionContext context = new AdmissionContext(empire, location, spec, records,
            IdentityKeys.of(empireId, location.coord(), spec.key()), request.quantityOrDefault(),
            deps.clock().instant());
        plan(context);

        CapacityResult capacity = capacityRate(context);
        if (capacity.value() <= 0) {
            throw new GameException(ErrorCode.NO_CAPACITY,
                "No " + capacityName() + " capacity at this base.",
                Map.of("capacityPerHour", capacity.value()));
        }
        context.setCapacity(capacity);
        checkCapacity(context);

        context.setEnergy(checkEnergy(context));
        return persist(context);
    }

    private CatalogSpec validate(AdmissionRequest request) {
        if (request == null || request.catalogKey() == null || request.catalogKey().isBlank()) {
            throw GameException.invalidField("catalogKey", "catalogKey is required.");
        }
        if (request.locationCoord() == null || request.locationCoord().isBlank()) {
            throw GameException.invalidField("locationCoord", "locationCoord is required.");
        }
        if (request.quantity() != null && request.quantity() < 1) {
            throw GameException.invalidField("quantity", "quantity must be at least 1.");
        }
        return deps.catalog().resolve(type, request.catalogKey())
            .orElseThrow(() -> GameException.invalidField("catalogKey",
                "Unknown " + type.wireName() + " key: " + request.catalogKey()));
    }

    private void checkTech(Empire empire, CatalogSpec spec) {
        List<Map<String, Object>> unmet = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        for (TechPrereq prereq : spec.techPrereqs()) {
            int current = empire.techLevel(prereq.tech().key());
            if (current < prereq.level()) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("key", prereq.tech().key());
                item.put("requiredLevel", prereq.level());
                item.put("currentLevel", current);
                unmet.add(item);
                reasons.add("Requires " + prereq.tech().displayName() + " " + prereq.level()
                    + " (current " + current + ").");
            }
        }
        if (!unmet.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("unmet", unmet);
            details.put("reasons", reasons);
            throw new GameException(ErrorCode.TECH_REQUIREMENTS,
                "Technology requirements not met for " + spec.displayName() + ".", details);
        }
    }

    private EnergyProjection checkEnergy(AdmissionContext context) {
        EnergyBalance balance = deps.ledger().energyBalance(context.location(), context.records());
        List<QueuedEnergyItem> queued = new ArrayList<>();
        for (QueuedEnergyItem item : deps.ledger().queuedEnergyItems(context.location(), context.records())) {
            if (!isSameItem(item, context)) {
                queued.add(item);
            }
        }
        long delta = energyDelta(context);
        EnergyProjection projection = deps.gate().evaluate(balance, queued, delta);
        log.info("[{}.start] key={} delta={} produced={} consumed={} balance={} reserved={} projectedEnergy={}",
            serviceName(), context.spec().key(), delta, projection.produced(), projection.consumed(),
            projection.balance(), projection.reservedNegative(), projection.projectedEnergy());
        if (!projection.admitted()) {
            throw new GameException(ErrorCode.INSUFFICIENT_ENERGY,
                "Insufficient energy for " + context.spec().displayName() + ".", projection.toDetails());
        }
        return projection;
    }

    /**
     * Whether a queued energy item is the candidate's own in-flight change, which the
     * identity check reports instead.
     */
    protected boolean isSameItem(QueuedEnergyItem item, AdmissionContext context) {
        return false;
    }

    protected String serviceName() {
        return getClass().getSimpleName();
    }

    protected static String etaText(int minutes) {
        return "ETA " + minutes + " minute(s).";
    }

    /**
     * Sets the target level and credits cost on the context.
     */
    protected abstract void plan(AdmissionContext context);

    protected abstract CapacityResult capacityRate(AdmissionContext context);

    protected abstract String capacityName();

    /**
     * Queue-specific checks after the rate is known to be positive.
     */
    protected void checkCapacity(AdmissionContext context) {
    }

    protected long energyDelta(AdmissionContext context) {
        return context.spec().energyDelta();
    }

    /**
     * Writes the item behind the identity guard and returns the admission result.
     */
    protected abstract AdmissionResult persist(AdmissionContext context);
}
