package org.attrition.engine.services.gameloop;

import org.attrition.engine.model.QueueType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters of one tick, per queue type.
 */
public final class TickSummary {

    /**
     * Counters of one queue type.
     */
    public static final class Counters {
        private int activated;
        private int completed;
        private int cancelled;
        private int scheduled;
        private int errors;

        public int getActivated() {
            return activated;
        }

        public int getCompleted() {
            return completed;
        }

        public int getCancelled() {
            return cancelled;
        }

        public int getScheduled() {
            return scheduled;
        }

        public int getErrors() {
            return errors;
        }

        int total() {
            return activated + completed + cancelled + scheduled + errors;
        }
    }

    private final Map<QueueType, Counters> counters = new EnumMap<>(QueueType.class);
    private int incomeUpdates;
    private int incomeErrors;
    private long durationMs;

    public TickSummary() {
        for (QueueType type : QueueType.values()) {
            counters.put(type, new Counters());
        }
    }

    public Counters get(QueueType type) {
        return counters.get(type);
    }

    public Map<QueueType, Counters> getCounters() {
        return Collections.unmodifiableMap(counters);
    }

    public int getIncomeUpdates() {
        return incomeUpdates;
    }

    public long getDurationMs() {
        return durationMs;
    }

    void activated(QueueType type) {
        counters.get(type).activated++;
    }

    void completed(QueueType type) {
        counters.get(type).completed++;
    }

    void cancelled(QueueType type) {
        counters.get(type).cancelled++;
    }

    void scheduled(QueueType type) {
        counters.get(type).scheduled++;
    }

    void error(QueueType type) {
        counters.get(type).errors++;
    }

    void incomeUpdated() {
        incomeUpdates++;
    }

    void incomeError() {
        incomeErrors++;
    }

    public int getIncomeErrors() {
        return incomeErrors;
    }

    void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public int totalErrors() {
        return incomeErrors + counters.values().stream().mapToInt(Counters::getErrors).sum();
    }

    /**
     * @return whether anything changed or failed during the tick
     */
    public boolean hasActivity() {
        return incomeUpdates > 0 || incomeErrors > 0 || counters.values().stream().anyMatch(c -> c.total() > 0);
    }

    /**
     * Flat view for status responses: {@code research.completed}, {@code incomeUpdates}, ...
     */
    public Map<String, Number> toMap() {
        Map<String, Number> map = new LinkedHashMap<>();
        counters.forEach((type, c) -> {
            String prefix = type.wireName() + ".";
            map.put(prefix + "activated", c.activated);
            map.put(prefix + "completed", c.completed);
            map.put(prefix + "cancelled", c.cancelled);
            map.put(prefix + "scheduled", c.scheduled);
            map.put(prefix + "errors", c.errors);
        });
        map.put("incomeUpdates", incomeUpdates);
        map.put("incomeErrors", incomeErrors);
        map.put("durationMs", durationMs);
        return map;
    }
}
