package org.attrition.engine.ledger;

import org.attrition.engine.model.RecordKind;

/**
 * One in-flight change at a base and the energy step it will add once active.
 *
 * @param recordId       record id
 * @param kind           structure or defense
 * @param catalogKey     catalog key
 * @param admissionOrder admission order, lower is earlier
 * @param delta          energy step, negative for consumers
 */
public record QueuedEnergyItem(long recordId, RecordKind kind, String catalogKey, long admissionOrder, long delta) {
}
