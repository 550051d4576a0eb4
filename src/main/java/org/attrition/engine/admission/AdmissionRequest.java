package org.attrition.engine.admission;

/**
 * A start request as received from a caller.
 *
 * @param locationCoord base coordinate
 * @param catalogKey    what to build or research
 * @param quantity      units to build; {@code null} means 1
 */
public record AdmissionRequest(String locationCoord, String catalogKey, Integer quantity) {

    public static AdmissionRequest of(String locationCoord, String catalogKey) {
        return new AdmissionRequest(locationCoord, catalogKey, null);
    }

    public int quantityOrDefault() {
        return quantity == null ? 1 : quantity;
    }
}
