package org.attrition.engine.api.services;

import org.attrition.engine.api.resources.OperationalError;

import java.util.List;
import java.util.Map;

/**
 * Represents the complete status of a service at a specific point in time.
 *
 * @param state   The current state of the service (e.g. RUNNING, PAUSED).
 * @param healthy Whether the service reports itself as healthy.
 * @param metrics A map of metrics for the service.
 * @param errors  A list of operational errors reported by the service.
 */
public record ServiceStatus(
    IService.State state,
    boolean healthy,
    Map<String, Number> metrics,
    List<OperationalError> errors
) {
}
