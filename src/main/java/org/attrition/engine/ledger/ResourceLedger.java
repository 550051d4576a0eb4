package org.attrition.engine.ledger;

import org.attrition.engine.catalog.Catalog;
import org.attrition.engine.catalog.CatalogSpec;
import org.attrition.engine.catalog.StructureKey;
import org.attrition.engine.model.BaseRecord;
import org.attrition.engine.model.Location;
import org.attrition.engine.model.RecordKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Derives a base's energy, area, population and income from its records. Nothing is
 * cached; callers pass the records they just read.
 * <p>
 * Records count at their {@link BaseRecord#effectiveLevel()}: pending upgrades keep
 * contributing their current level while the next one is in flight. Each in-flight change
 * contributes one further step through {@link #queuedEnergyItems(Location, List)}.
 */
public class ResourceLedger {

    private final Catalog catalog;
    private final int baselineEnergy;

    public ResourceLedger(Catalog catalog, int baselineEnergy) {
        this.catalog = catalog;
        this.baselineEnergy = baselineEnergy;
    }

    public EnergyBalance energyBalance(Location location, List<BaseRecord> records) {
        long produced = baselineEnergy;
        long consumed = 0;
        for (BaseRecord record : records) {
            int level = record.effectiveLevel();
            if (level == 0) {
                continue;
            }
            long step = energyStep(location, record.kind(), record.catalogKey());
            if (step >= 0) {
                produced += step * level;
            } else {
                consumed += -step * level;
            }
        }
        return new EnergyBalance(produced, consumed);
    }

    /**
     * In-flight changes of a base with the energy step each will add, in admission order.
     */
    public List<QueuedEnergyItem> queuedEnergyItems(Location location, List<BaseRecord> records) {
        List<QueuedEnergyItem> items = new ArrayList<>();
        for (BaseRecord record : records) {
            if (record.inFlight()) {
                items.add(new QueuedEnergyItem(record.id(), record.kind(), record.catalogKey(),
                    record.admissionOrder(), energyStep(location, record.kind(), record.catalogKey())));
            }
        }
        items.sort(Comparator.comparingLong(QueuedEnergyItem::admissionOrder));
        return items;
    }

    /**
     * Energy one level of the given record adds. Solar and gas plants scale with the
     * location's environment; everything else uses the catalog delta.
     */
    public long energyStep(Location location, RecordKind kind, String catalogKey) {
        if (kind == RecordKind.STRUCTURE) {
            Optional<StructureKey> structure = StructureKey.fromKey(catalogKey);
            if (structure.isEmpty()) {
                return 0;
            }
            switch (structure.get()) {
                case SOLAR_PLANTS:
                    return location.solarEnergy();
                case GAS_PLANTS:
                    return location.gasYield();
                default:
                    return structure.get().energyDelta();
            }
        }
        return catalog.resolve(kind.queueType(), catalogKey).map(CatalogSpec::energyDelta).orElse(0);
    }

    public SpaceUsage area(Location location, List<BaseRecord> records) {
        long capacity = location.area();
        long used = 0;
        long reserved = 0;
        long pendingGain = 0;
        for (BaseRecord record : records) {
            Optional<StructureKey> structure = structureOf(record);
            if (structure.isEmpty()) {
                continue;
            }
            int level = record.effectiveLevel();
            int gainPerLevel = areaGain(structure.get());
            capacity += (long) gainPerLevel * level;
            used += (long) structure.get().areaCost() * level;
            if (record.inFlight()) {
                reserved += structure.get().areaCost();
                pendingGain += gainPerLevel;
            }
        }
        return new SpaceUsage(capacity, used, reserved, pendingGain);
    }

    public SpaceUsage population(Location location, List<BaseRecord> records) {
        long capacity = 0;
        long used = 0;
        long reserved = 0;
        long pendingGain = 0;
        for (BaseRecord record : records) {
            Optional<StructureKey> structure = structureOf(record);
            if (structure.isEmpty()) {
                continue;
            }
            int level = record.effectiveLevel();
            int gainPerLevel = populationGain(location, structure.get());
            capacity += (long) gainPerLevel * level;
            used += (long) structure.get().populationCost() * level;
            if (record.inFlight()) {
                reserved += structure.get().populationCost();
                pendingGain += gainPerLevel;
            }
        }
        return new SpaceUsage(capacity, used, reserved, pendingGain);
    }

    /**
     * Sum of effective levels of a structure at a base.
     */
    public int structureLevel(List<BaseRecord> records, StructureKey key) {
        int total = 0;
        for (BaseRecord record : records) {
            if (record.kind() == RecordKind.STRUCTURE && key.key().equals(record.catalogKey())) {
                total += record.effectiveLevel();
            }
        }
        return total;
    }

    /**
     * Credits per hour produced by the given records.
     */
    public long incomePerHour(List<BaseRecord> records) {
        long income = 0;
        for (BaseRecord record : records) {
            Optional<StructureKey> structure = structureOf(record);
            if (structure.isPresent()) {
                income += (long) structure.get().economy() * record.effectiveLevel();
            }
        }
        return income;
    }

    private static Optional<StructureKey> structureOf(BaseRecord record) {
        return record.kind() == RecordKind.STRUCTURE ? StructureKey.fromKey(record.catalogKey()) : Optional.empty();
    }

    private static int areaGain(StructureKey key) {
        switch (key) {
            case TERRAFORM:
                return 5;
            case MULTI_LEVEL_PLATFORMS:
                return 10;
            default:
                return 0;
        }
    }

    private static int populationGain(Location location, StructureKey key) {
        switch (key) {
            case URBAN_STRUCTURES:
                return location.fertility();
            case ORBITAL_BASE:
                return 10;
            default:
                return 0;
        }
    }
}
