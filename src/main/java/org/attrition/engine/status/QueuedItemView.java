package org.attrition.engine.status;

import org.attrition.engine.admission.EnergyProjection;
import org.attrition.engine.model.QueueItem;

/**
 * An in-flight item of a base.
 *
 * @param item   the item
 * @param energy the gate's evaluation of the item at its own admission position, or
 *               {@code null} for items without an energy effect
 */
public record QueuedItemView(QueueItem item, EnergyProjection energy) {
}
