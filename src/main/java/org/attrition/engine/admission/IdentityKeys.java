package org.attrition.engine.admission;

/**
 * Deterministic identity keys: {@code empireId:locationCoord:catalogKey}.
 */
public final class IdentityKeys {

    private IdentityKeys() {
    }

    public static String of(String empireId, String coord, String catalogKey) {
        return empireId + ":" + coord + ":" + catalogKey;
    }
}
