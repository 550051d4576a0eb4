package org.attrition.engine.api.resources;

import java.util.List;
import java.util.Map;

/**
 * Counters, recent errors and a health flag, as reported by the game-loop status endpoint.
 */
public interface IMonitorable {

    /**
     * @return counters by name, such as {@code ticks_completed} or {@code identity_conflicts}
     */
    Map<String, Number> getMetrics();

    /**
     * @return the recorded errors, oldest first
     */
    List<OperationalError> getErrors();

    void clearErrors();

    boolean isHealthy();
}
