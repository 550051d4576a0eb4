package org.attrition.engine.admission;

/**
 * Converts a credits cost into a duration using an hourly capacity rate.
 */
public final class Eta {

    private Eta() {
    }

    /**
     * {@code max(1, ceil(cost * 60 / ratePerHour))}.
     *
     * @throws IllegalArgumentException if the rate is not positive
     */
    public static int minutes(long creditsCost, double ratePerHour) {
        if (!(ratePerHour > 0)) {
            throw new IllegalArgumentException("Capacity rate must be positive but was " + ratePerHour);
        }
        double minutes = Math.ceil((creditsCost * 60d) / ratePerHour);
        if (minutes >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return Math.max(1, (int) minutes);
    }
}
