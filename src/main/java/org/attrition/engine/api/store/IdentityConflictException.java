package org.attrition.engine.api.store;

/**
 * Thrown by the store when a write loses against a live entry with the same identity:
 * either a uniqueness violation on an identity column or a lost compare-and-set on an
 * idle record.
 */
public class IdentityConflictException extends RuntimeException {

    private final String identityKey;

    public IdentityConflictException(String identityKey, Throwable cause) {
        super("Identity already in use: " + identityKey, cause);
        this.identityKey = identityKey;
    }

    public String getIdentityKey() {
        return identityKey;
    }
}
