package org.attrition.engine.model;

import java.time.Instant;
import java.util.Map;

/**
 * An empire snapshot.
 *
 * @param id           empire id
 * @param name         display name
 * @param credits      spendable credits, never negative
 * @param techLevels   researched level per tech key
 * @param lastIncomeAt instant up to which income has been accrued
 */
public record Empire(String id, String name, long credits, Map<String, Integer> techLevels, Instant lastIncomeAt) {

    public Empire {
        techLevels = Map.copyOf(techLevels);
    }

    public int techLevel(String techKey) {
        return techLevels.getOrDefault(techKey, 0);
    }
}
