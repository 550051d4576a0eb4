package org.attrition.engine.status;

import org.attrition.engine.admission.EnergyProjection;
import org.attrition.engine.capacity.BaseCapacities;
import org.attrition.engine.ledger.SpaceUsage;

/**
 * Derived state of one base.
 *
 * @param coord      base coordinate
 * @param energy     balance of active records and the projection over all in-flight changes
 * @param area       area usage
 * @param population population usage
 * @param capacities hourly rates with their breakdowns
 */
public record BaseStats(String coord, EnergyProjection energy, SpaceUsage area, SpaceUsage population,
                        BaseCapacities capacities) {
}
