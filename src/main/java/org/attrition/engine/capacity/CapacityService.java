package org.attrition.engine.capacity;

import org.attrition.engine.api.store.IGameStore;
import org.attrition.engine.catalog.StructureKey;
import org.attrition.engine.catalog.TechKey;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.ledger.ResourceLedger;
import org.attrition.engine.model.BaseRecord;
import org.attrition.engine.model.Empire;
import org.attrition.engine.model.Location;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the hourly construction, production, research and citizen rates of a base.
 * Rates are recomputed on every call so that completions and cancellations are visible
 * immediately.
 */
public class CapacityService {

    private final IGameStore store;
    private final ResourceLedger ledger;
    private final CapacityBaselines baselines;

    public CapacityService(IGameStore store, ResourceLedger ledger, CapacityBaselines baselines) {
        this.store = store;
        this.ledger = ledger;
        this.baselines = baselines;
    }

    /**
     * Loads the base and computes its capacities.
     *
     * @throws GameException {@code NOT_FOUND} if the empire or the location does not exist
     */
    public BaseCapacities getBaseCapacities(String empireId, String coord) {
        Empire empire = store.findEmpire(empireId).orElseThrow(() -> GameException.notFound("Empire", empireId));
        Location location = store.findLocation(coord).orElseThrow(() -> GameException.notFound("Location", coord));
        return compute(empire, location, store.findRecords(empireId, coord));
    }

    public BaseCapacities compute(Empire empire, Location location, List<BaseRecord> records) {
        return new BaseCapacities(
            construction(empire, location, records),
            production(empire, location, records),
            research(empire, location, records),
            citizen(records));
    }

    public CapacityResult construction(Empire empire, Location location, List<BaseRecord> records) {
        List<BreakdownItem> items = new ArrayList<>();
        items.add(BreakdownItem.flat("baseline", baselines.construction()));
        addFlat(items, records, StructureKey.ROBOTIC_FACTORIES, 2);
        addFlat(items, records, StructureKey.NANITE_FACTORIES, 10);
        addFlat(items, records, StructureKey.ANDROID_FACTORIES, 18);
        addFlat(items, records, StructureKey.METAL_REFINERIES, location.metalYield());
        addTechPercent(items, empire, TechKey.CYBERNETICS);
        addEnvironmentPercent(items, "solarEnergy", location.solarEnergy());
        return CapacityResult.of(items);
    }

    public CapacityResult production(Empire empire, Location location, List<BaseRecord> records) {
        List<BreakdownItem> items = new ArrayList<>();
        items.add(BreakdownItem.flat("baseline", baselines.production()));
        addFlat(items, records, StructureKey.SHIPYARDS, 2);
        addFlat(items, records, StructureKey.ROBOTIC_FACTORIES, 2);
        addFlat(items, records, StructureKey.METAL_REFINERIES, location.metalYield());
        addTechPercent(items, empire, TechKey.CYBERNETICS);
        addEnvironmentPercent(items, "metalYield", location.metalYield());
        return CapacityResult.of(items);
    }

    public CapacityResult research(Empire empire, Location location, List<BaseRecord> records) {
        List<BreakdownItem> items = new ArrayList<>();
        items.add(BreakdownItem.flat("baseline", baselines.research()));
        addFlat(items, records, StructureKey.RESEARCH_LABS, 8);
        addTechPercent(items, empire, TechKey.ARTIFICIAL_INTELLIGENCE);
        addEnvironmentPercent(items, "fertility", location.fertility());
        return CapacityResult.of(items);
    }

    public CapacityResult citizen(List<BaseRecord> records) {
        List<BreakdownItem> items = new ArrayList<>();
        addFlat(items, records, StructureKey.URBAN_STRUCTURES, 3);
        addFlat(items, records, StructureKey.COMMAND_CENTERS, 1);
        addFlat(items, records, StructureKey.ORBITAL_BASE, 5);
        addFlat(items, records, StructureKey.CAPITAL, 8);
        addFlat(items, records, StructureKey.BIOSPHERE_MODIFICATION, 10);
        return CapacityResult.of(items);
    }

    private void addFlat(List<BreakdownItem> items, List<BaseRecord> records, StructureKey key, int perLevel) {
        int level = ledger.structureLevel(records, key);
        if (level > 0 && perLevel != 0) {
            items.add(BreakdownItem.flat(key.key(), (double) level * perLevel));
        }
    }

    private static void addTechPercent(List<BreakdownItem> items, Empire empire, TechKey tech) {
        if (empire.techLevel(tech.key()) >= 1) {
            items.add(BreakdownItem.percent(tech.key(), 5));
        }
    }

    private static void addEnvironmentPercent(List<BreakdownItem> items, String source, int value) {
        if (value > 0) {
            items.add(BreakdownItem.percent(source, value));
        }
    }
}
