package org.attrition.engine.capacity;

/**
 * One contribution to a capacity value.
 *
 * @param source what contributes (e.g. {@code baseline}, {@code robotic_factories}, {@code cybernetics})
 * @param value  flat amount per hour, or percentage points
 * @param kind   how the value is applied
 */
public record BreakdownItem(String source, double value, Kind kind) {

    public enum Kind {
        FLAT,
        PERCENT
    }

    public static BreakdownItem flat(String source, double value) {
        return new BreakdownItem(source, value, Kind.FLAT);
    }

    public static BreakdownItem percent(String source, double value) {
        return new BreakdownItem(source, value, Kind.PERCENT);
    }
}
