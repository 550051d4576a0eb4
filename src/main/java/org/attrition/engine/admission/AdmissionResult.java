package org.attrition.engine.admission;

import org.attrition.engine.model.QueueItem;

/**
 * A persisted admission.
 *
 * @param queueItem       the admitted item as stored after admission
 * @param etaMinutes      duration estimate at the current capacity rate
 * @param capacityPerHour the rate the estimate is based on
 * @param message         human-readable summary
 * @param energy          the energy evaluation the item passed
 */
public record AdmissionResult(QueueItem queueItem, int etaMinutes, double capacityPerHour, String message,
                              EnergyProjection energy) {
}
