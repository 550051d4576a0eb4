package org.attrition.engine.catalog;

/**
 * A minimum empire tech level.
 *
 * @param tech  the required technology
 * @param level the minimum level
 */
public record TechPrereq(TechKey tech, int level) {

    public static TechPrereq of(TechKey tech, int level) {
        return new TechPrereq(tech, level);
    }
}
