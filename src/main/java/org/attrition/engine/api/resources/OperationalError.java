package org.attrition.engine.api.resources;

import java.time.Instant;

/**
 * A failure the engine survived, e.g. one tick item that could not be completed.
 *
 * @param errorType short code such as {@code TICK_ITEM_FAILED}
 * @param details   the queue entry or record involved, if any
 */
public record OperationalError(Instant timestamp, String errorType, String message, String details) {
}
