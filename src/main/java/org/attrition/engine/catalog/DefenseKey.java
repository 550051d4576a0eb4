package org.attrition.engine.catalog;

import java.util.List;
import java.util.Optional;

import static org.attrition.engine.catalog.TechKey.DISRUPTOR;
import static org.attrition.engine.catalog.TechKey.ION;
import static org.attrition.engine.catalog.TechKey.LASER;
import static org.attrition.engine.catalog.TechKey.MISSILES;
import static org.attrition.engine.catalog.TechKey.PHOTON;
import static org.attrition.engine.catalog.TechKey.PLASMA;

/**
 * Planetary defenses. Each level is one more installation at a flat cost; installations
 * draw energy like structures do.
 */
public enum DefenseKey implements CatalogSpec {
    BARRACKS("barracks", "Barracks", 5, 0),
    LASER_TURRETS("laser_turrets", "Laser Turrets", 10, -1, TechPrereq.of(LASER, 1)),
    MISSILE_TURRETS("missile_turrets", "Missile Turrets", 20, -1, TechPrereq.of(MISSILES, 1)),
    PLASMA_TURRETS("plasma_turrets", "Plasma Turrets", 100, -2, TechPrereq.of(PLASMA, 1)),
    ION_TURRETS("ion_turrets", "Ion Turrets", 256, -3, TechPrereq.of(ION, 1)),
    PHOTON_TURRETS("photon_turrets", "Photon Turrets", 1024, -4, TechPrereq.of(PHOTON, 1)),
    DISRUPTOR_TURRETS("disruptor_turrets", "Disruptor Turrets", 4096, -8, TechPrereq.of(DISRUPTOR, 1)),
    DEFLECTION_SHIELDS("deflection_shields", "Deflection Shields", 4096, -8, TechPrereq.of(ION, 6)),
    PLANETARY_SHIELD("planetary_shield", "Planetary Shield", 25000, -16, TechPrereq.of(ION, 10)),
    PLANETARY_RING("planetary_ring", "Planetary Ring", 50000, -24, TechPrereq.of(PHOTON, 10));

    private final String key;
    private final String displayName;
    private final long creditsCost;
    private final int energyDelta;
    private final List<TechPrereq> prereqs;

    DefenseKey(String key, String displayName, long creditsCost, int energyDelta, TechPrereq... prereqs) {
        this.key = key;
        this.displayName = displayName;
        this.creditsCost = creditsCost;
        this.energyDelta = energyDelta;
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
        return 0;
    }

    public static Optional<DefenseKey> fromKey(String key) {
        for (DefenseKey defense : values()) {
            if (defense.key.equals(key)) {
                return Optional.of(defense);
            }
        }
        return Optional.empty();
    }
}
