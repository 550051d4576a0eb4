package org.attrition.engine.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Research catalog. {@link #requiredBuildingLevel()} is the number of research lab levels
 * the researching base must have.
 */
public enum TechKey implements CatalogSpec {
    ENERGY("energy", "Energy", 2, 1),
    COMPUTER("computer", "Computer", 2, 1),
    ARMOUR("armour", "Armour", 4, 2),
    LASER("laser", "Laser", 4, 2, TechPrereq.of(ENERGY, 2)),
    MISSILES("missiles", "Missiles", 8, 4, TechPrereq.of(COMPUTER, 4)),
    STELLAR_DRIVE("stellar_drive", "Stellar Drive", 16, 5, TechPrereq.of(ENERGY, 6)),
    PLASMA("plasma", "Plasma", 32, 6, TechPrereq.of(ENERGY, 6), TechPrereq.of(LASER, 4)),
    WARP_DRIVE("warp_drive", "Warp Drive", 64, 8, TechPrereq.of(ENERGY, 8), TechPrereq.of(STELLAR_DRIVE, 4)),
    SHIELDING("shielding", "Shielding", 128, 10, TechPrereq.of(ENERGY, 10)),
    ION("ion", "Ion", 256, 12, TechPrereq.of(ENERGY, 12), TechPrereq.of(LASER, 10)),
    STEALTH("stealth", "Stealth", 512, 14, TechPrereq.of(ENERGY, 14)),
    PHOTON("photon", "Photon", 1024, 16, TechPrereq.of(ENERGY, 16), TechPrereq.of(PLASMA, 8)),
    ARTIFICIAL_INTELLIGENCE("artificial_intelligence", "Artificial Intelligence", 2048, 18, TechPrereq.of(COMPUTER, 20)),
    DISRUPTOR("disruptor", "Disruptor", 4096, 20, TechPrereq.of(ENERGY, 20), TechPrereq.of(LASER, 18)),
    CYBERNETICS("cybernetics", "Cybernetics", 8192, 22, TechPrereq.of(ARTIFICIAL_INTELLIGENCE, 6)),
    TACHYON_COMMUNICATIONS("tachyon_communications", "Tachyon Communications", 32768, 24,
        TechPrereq.of(ENERGY, 24), TechPrereq.of(COMPUTER, 24)),
    ANTI_GRAVITY("anti_gravity", "Anti-Gravity", 100000, 26, TechPrereq.of(ENERGY, 26), TechPrereq.of(COMPUTER, 26));

    private final String key;
    private final String displayName;
    private final long creditsCost;
    private final int requiredLabs;
    private final List<TechPrereq> prereqs;

    TechKey(String key, String displayName, long creditsCost, int requiredLabs, TechPrereq... prereqs) {
        this.key = key;
        this.displayName = displayName;
        this.creditsCost = creditsCost;
        this.requiredLabs = requiredLabs;
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
        return requiredLabs;
    }

    public static Optional<TechKey> fromKey(String key) {
        for (TechKey tech : values()) {
            if (tech.key.equals(key)) {
                return Optional.of(tech);
            }
        }
        return Optional.empty();
    }
}
