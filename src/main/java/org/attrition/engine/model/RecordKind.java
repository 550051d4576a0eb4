package org.attrition.engine.model;

/**
 * Kind of a per-base record. Each kind has its own construction lane.
 */
public enum RecordKind {
    STRUCTURE,
    DEFENSE;

    public QueueType queueType() {
        return this == STRUCTURE ? QueueType.STRUCTURES : QueueType.DEFENSES;
    }
}
