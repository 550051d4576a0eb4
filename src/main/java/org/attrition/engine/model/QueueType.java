package org.attrition.engine.model;

import java.util.Optional;

/**
 * The four admission queues. Structures and defenses are backed by per-base records;
 * research and units by queue entries.
 */
public enum QueueType {
    STRUCTURES("structures"),
    DEFENSES("defenses"),
    RESEARCH("research"),
    UNITS("units");

    private final String wireName;

    QueueType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isRecordBacked() {
        return this == STRUCTURES || this == DEFENSES;
    }

    /**
     * @throws IllegalStateException for queues that are not record-backed
     */
    public RecordKind recordKind() {
        switch (this) {
            case STRUCTURES:
                return RecordKind.STRUCTURE;
            case DEFENSES:
                return RecordKind.DEFENSE;
            default:
                throw new IllegalStateException(this + " is not record-backed");
        }
    }

    public static Optional<QueueType> fromWireName(String name) {
        for (QueueType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
