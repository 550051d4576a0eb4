package org.attrition.engine.catalog;

import java.util.List;
import java.util.Optional;

import static org.attrition.engine.catalog.TechKey.ARMOUR;
import static org.attrition.engine.catalog.TechKey.ARTIFICIAL_INTELLIGENCE;
import static org.attrition.engine.catalog.TechKey.COMPUTER;
import static org.attrition.engine.catalog.TechKey.CYBERNETICS;
import static org.attrition.engine.catalog.TechKey.ENERGY;
import static org.attrition.engine.catalog.TechKey.LASER;
import static org.attrition.engine.catalog.TechKey.TACHYON_COMMUNICATIONS;
import static org.attrition.engine.catalog.TechKey.WARP_DRIVE;

/**
 * Base structures. Solar and gas plants produce according to the location's environment
 * rather than their nominal {@link #energyDelta()}; see the resource ledger.
 */
public enum StructureKey implements CatalogSpec {
    URBAN_STRUCTURES("urban_structures", "Urban Structures", 1, 0, 0, 0, 1),
    SOLAR_PLANTS("solar_plants", "Solar Plants", 1, 1, 0, 1, 1),
    GAS_PLANTS("gas_plants", "Gas Plants", 1, 1, 0, 1, 1),
    FUSION_PLANTS("fusion_plants", "Fusion Plants", 20, 4, 0, 1, 1, TechPrereq.of(ENERGY, 6)),
    ANTIMATTER_PLANTS("antimatter_plants", "Antimatter Plants", 2000, 10, 0, 1, 1, TechPrereq.of(ENERGY, 20)),
    ORBITAL_PLANTS("orbital_plants", "Orbital Plants", 40000, 12, 0, 1, 0, TechPrereq.of(ENERGY, 25)),
    RESEARCH_LABS("research_labs", "Research Labs", 2, -1, 0, 1, 1),
    METAL_REFINERIES("metal_refineries", "Metal Refineries", 1, -1, 1, 1, 1),
    CRYSTAL_MINES("crystal_mines", "Crystal Mines", 2, -1, 0, 1, 1),
    ROBOTIC_FACTORIES("robotic_factories", "Robotic Factories", 5, -1, 1, 1, 1, TechPrereq.of(COMPUTER, 2)),
    COMMAND_CENTERS("command_centers", "Command Centers", 20, -1, 0, 1, 1, TechPrereq.of(COMPUTER, 6)),
    SHIPYARDS("shipyards", "Shipyards", 5, -1, 1, 1, 1),
    ORBITAL_SHIPYARDS("orbital_shipyards", "Orbital Shipyards", 10000, -12, 2, 1, 0, TechPrereq.of(CYBERNETICS, 2)),
    SPACEPORTS("spaceports", "Spaceports", 5, -1, 2, 1, 1),
    NANITE_FACTORIES("nanite_factories", "Nanite Factories", 80, -2, 2, 1, 1,
        TechPrereq.of(COMPUTER, 10), TechPrereq.of(LASER, 8)),
    ANDROID_FACTORIES("android_factories", "Android Factories", 1000, -4, 2, 1, 1,
        TechPrereq.of(ARTIFICIAL_INTELLIGENCE, 4)),
    ECONOMIC_CENTERS("economic_centers", "Economic Centers", 80, -2, 3, 1, 1, TechPrereq.of(COMPUTER, 10)),
    TERRAFORM("terraform", "Terraform", 80, 0, 0, 0, 1, TechPrereq.of(COMPUTER, 10), TechPrereq.of(ENERGY, 10)),
    MULTI_LEVEL_PLATFORMS("multi_level_platforms", "Multi-Level Platforms", 10000, 0, 0, 0, 1, TechPrereq.of(ARMOUR, 22)),
    ORBITAL_BASE("orbital_base", "Orbital Base", 2000, 0, 0, 0, 1, TechPrereq.of(COMPUTER, 20)),
    JUMP_GATE("jump_gate", "Jump Gate", 5000, -12, 0, 1, 1, TechPrereq.of(WARP_DRIVE, 12), TechPrereq.of(ENERGY, 20)),
    BIOSPHERE_MODIFICATION("biosphere_modification", "Biosphere Modification", 20000, -24, 0, 1, 1,
        TechPrereq.of(COMPUTER, 24), TechPrereq.of(ENERGY, 24)),
    CAPITAL("capital", "Capital", 15000, -12, 10, 1, 1, TechPrereq.of(TACHYON_COMMUNICATIONS, 1));

    private final String key;
    private final String displayName;
    private final long creditsCost;
    private final int energyDelta;
    private final int economy;
    private final int populationCost;
    private final int areaCost;
    private final List<TechPrereq> prereqs;

    StructureKey(String key, String displayName, long creditsCost, int energyDelta, int economy,
                 int populationCost, int areaCost, TechPrereq... prereqs) {
        this.key = key;
        this.displayName = displayName;
        this.creditsCost = creditsCost;
        this.energyDelta = energyDelta;
        this.economy = economy;
        this.populationCost = populationCost;
        this.areaCost = areaCost;
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
        return energyDelta;
    }

    /**
     * @return credits per hour contributed by each active level
     */
    public int economy() {
        return economy;
    }

    @Override
    public List<TechPrereq> techPrereqs() {
        return prereqs;
    }

    @Override
    public int areaCost() {
        return areaCost;
    }

    @Override
    public int populationCost() {
        return populationCost;
    }

    @Override
    public int requiredBuildingLevel() {
        return 0;
    }

    public static Optional<StructureKey> fromKey(String key) {
        for (StructureKey structure : values()) {
            if (structure.key.equals(key)) {
                return Optional.of(structure);
            }
        }
        return Optional.empty();
    }
}
