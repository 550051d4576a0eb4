package org.attrition.engine.admission;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of an energy feasibility evaluation.
 *
 * @param produced         energy produced by effectively active records
 * @param consumed         energy consumed by effectively active records
 * @param balance          produced minus consumed
 * @param reservedNegative consumer steps of earlier in-flight changes, never positive
 * @param reservedPositive producer steps of earlier in-flight changes, never negative
 * @param delta            energy step of the evaluated item
 * @param projectedEnergy  balance plus both reservations plus delta
 * @param admitted         whether the item passes the gate
 */
public record EnergyProjection(long produced, long consumed, long balance, long reservedNegative,
                               long reservedPositive, long delta, long projectedEnergy, boolean admitted) {

    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("produced", produced);
        details.put("consumed", consumed);
        details.put("balance", balance);
        details.put("reservedNegative", reservedNegative);
        details.put("reservedPositive", reservedPositive);
        details.put("delta", delta);
        details.put("projectedEnergy", projectedEnergy);
        return details;
    }
}
