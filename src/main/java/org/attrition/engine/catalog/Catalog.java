package org.attrition.engine.catalog;

import org.attrition.engine.model.QueueType;

import java.util.Optional;

/**
 * Typed lookup over the static catalogs, plus the per-level cost rule.
 * <p>
 * Level 1 costs the catalog's {@link CatalogSpec#creditsCost()}. Structures and research
 * grow by a factor of 1.5 per level, rounded at every step; defenses and units cost the
 * same for every installation.
 */
public final class Catalog {

    public Optional<CatalogSpec> resolve(QueueType type, String key) {
        if (key == null) {
            return Optional.empty();
        }
        switch (type) {
            case STRUCTURES:
                return StructureKey.fromKey(key).map(CatalogSpec.class::cast);
            case DEFENSES:
                return DefenseKey.fromKey(key).map(CatalogSpec.class::cast);
            case RESEARCH:
                return TechKey.fromKey(key).map(CatalogSpec.class::cast);
            case UNITS:
                return UnitKey.fromKey(key).map(CatalogSpec.class::cast);
            default:
                throw new IllegalArgumentException("Unknown queue type " + type);
        }
    }

    /**
     * Credits needed to reach {@code level} from {@code level - 1}.
     *
     * @param type  queue the spec belongs to
     * @param spec  catalog entry
     * @param level target level, at least 1
     * @return the cost, never below 1 for a non-free entry
     */
    public long costForLevel(QueueType type, CatalogSpec spec, int level) {
        if (level < 1) {
            throw new IllegalArgumentException("Level must be >= 1 but was " + level);
        }
        long cost = spec.creditsCost();
        if (type == QueueType.DEFENSES || type == QueueType.UNITS) {
            return cost;
        }
        for (int l = 2; l <= level; l++) {
            cost = Math.round(cost * 1.5d);
        }
        return Math.max(1, cost);
    }
}
