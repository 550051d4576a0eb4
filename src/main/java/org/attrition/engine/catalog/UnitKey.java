package org.attrition.engine.catalog;

import java.util.List;
import java.util.Optional;

import static org.attrition.engine.catalog.TechKey.ARMOUR;
import static org.attrition.engine.catalog.TechKey.ENERGY;
import static org.attrition.engine.catalog.TechKey.ION;
import static org.attrition.engine.catalog.TechKey.LASER;
import static org.attrition.engine.catalog.TechKey.MISSILES;
import static org.attrition.engine.catalog.TechKey.PLASMA;
import static org.attrition.engine.catalog.TechKey.SHIELDING;
import static org.attrition.engine.catalog.TechKey.STELLAR_DRIVE;
import static org.attrition.engine.catalog.TechKey.WARP_DRIVE;

/**
 * Units built at a base's shipyards. {@link #requiredBuildingLevel()} is the minimum
 * shipyards level.
 */
public enum UnitKey implements CatalogSpec {
    FIGHTERS("fighters", "Fighters", 5, 1, TechPrereq.of(LASER, 1)),
    BOMBERS("bombers", "Bombers", 10, 2, TechPrereq.of(MISSILES, 1)),
    HEAVY_BOMBERS("heavy_bombers", "Heavy Bombers", 30, 3, TechPrereq.of(PLASMA, 2)),
    ION_BOMBERS("ion_bombers", "Ion Bombers", 60, 3, TechPrereq.of(ION, 1)),
    CORVETTE("corvette", "Corvette", 20, 4, TechPrereq.of(LASER, 2), TechPrereq.of(STELLAR_DRIVE, 1)),
    RECYCLER("recycler", "Recycler", 30, 5, TechPrereq.of(ENERGY, 2)),
    DESTROYER("destroyer", "Destroyer", 40, 6, TechPrereq.of(PLASMA, 1), TechPrereq.of(ARMOUR, 6)),
    FRIGATE("frigate", "Frigate", 80, 8, TechPrereq.of(MISSILES, 6), TechPrereq.of(WARP_DRIVE, 1)),
    SCOUT_SHIP("scout_ship", "Scout Ship", 40, 8, TechPrereq.of(WARP_DRIVE, 1), TechPrereq.of(SHIELDING, 1)),
    OUTPOST_SHIP("outpost_ship", "Outpost Ship", 100, 8, TechPrereq.of(WARP_DRIVE, 1));

    private final String key;
    private final String displayName;
    private final long creditsCost;
    private final int requiredShipyardLevel;
    private final List<TechPrereq> prereqs;

    UnitKey(String key, String displayName, long creditsCost, int requiredShipyardLevel, TechPrereq... prereqs) {
        this.key = key;
        this.displayName = displayName;
        this.creditsCost = creditsCost;
        this.requiredShipyardLevel = requiredShipyardLevel;
        this.prereqs = List.of(prereqs);
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public long creditsCost() {
        return creditsCost;
    }

    @Override
    public int energyDelta() {
        return 0;
    }

    @Override
    public List<TechPrereq> techPrereqs() {
        return prereqs;
    }

    @Override
    public int areaCost() {
        return 0;
    }

    @Override
    public int populationCost() {
        return 0;
    }

    @Override
    public int requiredBuildingLevel() {
        return requiredShipyardLevel;
    }

    public static Optional<UnitKey> fromKey(String key) {
        for (UnitKey unit : values()) {
            if (unit.key.equals(key)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }
}
