package org.attrition.engine.admission;

import org.attrition.engine.ledger.EnergyBalance;
import org.attrition.engine.ledger.QueuedEnergyItem;

import java.util.List;

/**
 * Decides whether an energy consumer can be sustained by a base.
 * <p>
 * Only in-flight changes admitted before the evaluated item are reserved, so a producer
 * queued after a consumer never covers it. Producers and neutral items always pass.
 */
public class EnergyFeasibilityGate {

    /**
     * Evaluates a new candidate, which is later than every queued item.
     */
    public EnergyProjection evaluate(EnergyBalance balance, List<QueuedEnergyItem> queued, long delta) {
        return project(balance, queued, Long.MAX_VALUE, delta);
    }

    /**
     * Evaluates an already queued item at its own position.
     */
    public EnergyProjection evaluateQueued(EnergyBalance balance, List<QueuedEnergyItem> queued, QueuedEnergyItem item) {
        return project(balance, queued, item.admissionOrder(), item.delta());
    }

    private EnergyProjection project(EnergyBalance balance, List<QueuedEnergyItem> queued, long beforeOrder, long delta) {
        long reservedNegative = 0;
        long reservedPositive = 0;
        for (QueuedEnergyItem item : queued) {
            if (item.admissionOrder() >= beforeOrder) {
                continue;
            }
            if (item.delta() < 0) {
                reservedNegative += item.delta();
            } else {
                reservedPositive += item.delta();
            }
        }
        long projected = balance.balance() + reservedNegative + reservedPositive + delta;
        boolean admitted = delta >= 0 || projected >= 0;
        return new EnergyProjection(balance.produced(), balance.consumed(), balance.balance(),
            reservedNegative, reservedPositive, delta, projected, admitted);
    }
}
