package org.attrition.engine.errors;

/**
 * Closed taxonomy of failures reported to API callers. Each code carries the HTTP status
 * it is mapped to.
 */
public enum ErrorCode {
    INVALID_REQUEST(400),
    TECH_REQUIREMENTS(400),
    NO_CAPACITY(400),
    INSUFFICIENT_AREA(400),
    INSUFFICIENT_POPULATION(400),
    INSUFFICIENT_LABS(400),
    INSUFFICIENT_SHIPYARD(400),
    INSUFFICIENT_RESOURCES(400),
    INSUFFICIENT_ENERGY(400),
    NOT_FOUND(404),
    NOT_OWNER(404),
    ALREADY_IN_PROGRESS(409),
    DB_ERROR(500),
    INTERNAL_ERROR(500);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
