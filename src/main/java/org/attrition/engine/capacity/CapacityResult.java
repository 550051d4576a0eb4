package org.attrition.engine.capacity;

import java.util.List;

/**
 * An hourly rate and how it was composed: the flat items are summed, then scaled by one
 * plus the sum of the percent items.
 *
 * @param value     the resulting rate per hour
 * @param breakdown contributions in evaluation order
 */
public record CapacityResult(double value, List<BreakdownItem> breakdown) {

    public CapacityResult {
        breakdown = List.copyOf(breakdown);
    }

    public static CapacityResult of(List<BreakdownItem> breakdown) {
        double flat = 0;
        double percent = 0;
        for (BreakdownItem item : breakdown) {
            if (item.kind() == BreakdownItem.Kind.FLAT) {
                flat += item.value();
            } else {
                percent += item.value();
            }
        }
        return new CapacityResult(flat * (1 + percent / 100d), breakdown);
    }
}
