package org.attrition.engine.catalog;

import java.util.List;

/**
 * Immutable catalog entry for anything a base can queue.
 */
public interface CatalogSpec {

    /**
     * @return the stable key used on the wire and in storage (e.g. {@code research_labs})
     */
    String key();

    String displayName();

    /**
     * @return level-1 credits cost
     */
    long creditsCost();

    /**
     * Energy change per level once active. Negative for consumers.
     */
    int energyDelta();

    List<TechPrereq> techPrereqs();

    int areaCost();

    int populationCost();

    /**
     * Level of the gating building at the base (research labs for research, shipyards for
     * units), or 0 when nothing is required.
     */
    int requiredBuildingLevel();
}
