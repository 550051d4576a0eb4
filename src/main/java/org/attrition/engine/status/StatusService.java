package org.attrition.engine.status;

import org.attrition.engine.admission.EnergyFeasibilityGate;
import org.attrition.engine.admission.EnergyProjection;
import org.attrition.engine.api.store.IGameStore;
import org.attrition.engine.capacity.CapacityService;
import org.attrition.engine.economy.EconomyService;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.ledger.EnergyBalance;
import org.attrition.engine.ledger.QueuedEnergyItem;
import org.attrition.engine.ledger.ResourceLedger;
import org.attrition.engine.model.BaseRecord;
import org.attrition.engine.model.Empire;
import org.attrition.engine.model.Location;
import org.attrition.engine.model.QueueEntry;
import org.attrition.engine.model.QueueItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views of bases and empires. Everything is derived from a fresh read.
 */
public class StatusService {

    private final IGameStore store;
    private final ResourceLedger ledger;
    private final CapacityService capacityService;
    private final EnergyFeasibilityGate gate;
    private final EconomyService economy;

    public StatusService(IGameStore store, ResourceLedger ledger, CapacityService capacityService,
                         EnergyFeasibilityGate gate, EconomyService economy) {
        this.store = store;
        this.ledger = ledger;
        this.capacityService = capacityService;
        this.gate = gate;
        this.economy = economy;
    }

    public BaseStats baseStats(String empireId, String coord) {
        Empire empire = empire(empireId);
        Location location = ownedLocation(empireId, coord);
        List<BaseRecord> records = store.findRecords(empireId, coord);
        EnergyBalance balance = ledger.energyBalance(location, records);
        EnergyProjection energy = gate.evaluate(balance, ledger.queuedEnergyItems(location, records), 0);
        return new BaseStats(coord, energy, ledger.area(location, records), ledger.population(location, records),
            capacityService.compute(empire, location, records));
    }

    /**
     * In-flight records in admission order, followed by live research and unit entries.
     */
    public List<QueuedItemView> baseQueue(String empireId, String coord) {
        empire(empireId);
        Location location = ownedLocation(empireId, coord);
        List<BaseRecord> records = store.findRecords(empireId, coord);
        EnergyBalance balance = ledger.energyBalance(location, records);
        List<QueuedEnergyItem> queued = ledger.queuedEnergyItems(location, records);

        Map<Long, BaseRecord> byId = new HashMap<>();
        records.forEach(r -> byId.put(r.id(), r));
        List<QueuedItemView> views = new ArrayList<>();
        for (QueuedEnergyItem item : queued) {
            views.add(new QueuedItemView(QueueItem.of(byId.get(item.recordId())),
                gate.evaluateQueued(balance, queued, item)));
        }
        store.findLiveEntries(empireId, coord).stream()
            .sorted(Comparator.comparing(QueueEntry::createdAt))
            .forEach(entry -> views.add(new QueuedItemView(QueueItem.of(entry), null)));
        return views;
    }

    public EmpireView empireView(String empireId) {
        Empire empire = empire(empireId);
        Map<String, Map<String, Long>> units = new LinkedHashMap<>();
        for (Location location : store.findLocationsOwnedBy(empireId)) {
            Map<String, Long> counts = store.findUnitCounts(empireId, location.coord());
            if (!counts.isEmpty()) {
                units.put(location.coord(), counts);
            }
        }
        return new EmpireView(empire, economy.incomePerHour(empireId), units);
    }

    private Empire empire(String empireId) {
        return store.findEmpire(empireId).orElseThrow(() -> GameException.notFound("Empire", empireId));
    }

    private Location ownedLocation(String empireId, String coord) {
        Location location = store.findLocation(coord).orElseThrow(() -> GameException.notFound("Location", coord));
        if (!location.isOwnedBy(empireId)) {
            throw new GameException(ErrorCode.NOT_OWNER,
                "Location " + coord + " is not owned by empire " + empireId + ".");
        }
        return location;
    }
}
