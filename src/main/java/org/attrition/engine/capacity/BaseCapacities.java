package org.attrition.engine.capacity;

/**
 * Hourly rates of one base.
 */
public record BaseCapacities(CapacityResult construction, CapacityResult production,
                             CapacityResult research, CapacityResult citizen) {
}
