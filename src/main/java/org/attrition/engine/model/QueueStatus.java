package org.attrition.engine.model;

/**
 * Lifecycle of a research or unit queue entry.
 * <ul>
 *   <li>{@code PENDING}: inserted, debit not yet applied</li>
 *   <li>{@code QUEUED}: admitted but uncharged, waiting for credits or capacity</li>
 *   <li>{@code ACTIVE}: charged, timer running until {@code completesAt}</li>
 *   <li>{@code COMPLETED}, {@code CANCELLED}: terminal</li>
 * </ul>
 */
public enum QueueStatus {
    PENDING,
    QUEUED,
    ACTIVE,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
