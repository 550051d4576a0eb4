package org.attrition.engine.capacity;

import com.typesafe.config.Config;

/**
 * Flat per-hour rates every base has before any structure.
 */
public record CapacityBaselines(double construction, double production, double research) {

    public static CapacityBaselines defaults() {
        return new CapacityBaselines(40, 0, 0);
    }

    /**
     * Reads {@code baseConstructionPerHour}, {@code baseProductionPerHour} and
     * {@code baseResearchPerHour}, falling back to {@link #defaults()}.
     */
    public static CapacityBaselines fromConfig(Config options) {
        CapacityBaselines defaults = defaults();
        return new CapacityBaselines(
            options.hasPath("baseConstructionPerHour") ? options.getDouble("baseConstructionPerHour") : defaults.construction(),
            options.hasPath("baseProductionPerHour") ? options.getDouble("baseProductionPerHour") : defaults.production(),
            options.hasPath("baseResearchPerHour") ? options.getDouble("baseResearchPerHour") : defaults.research());
    }
}
