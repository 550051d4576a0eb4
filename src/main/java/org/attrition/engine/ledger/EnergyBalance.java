package org.attrition.engine.ledger;

/**
 * Energy produced and consumed by the effectively active records of a base.
 */
public record EnergyBalance(long produced, long consumed) {

    public long balance() {
        return produced - consumed;
    }
}
