package org.attrition.engine.admission;

import org.attrition.engine.capacity.CapacityResult;
import org.attrition.engine.catalog.CatalogSpec;
import org.attrition.engine.model.BaseRecord;
import org.attrition.engine.model.Empire;
import org.attrition.engine.model.Location;

import java.time.Instant;
import java.util.List;

/**
 * State carried through the stages of one admission. The read-only part is fixed once
 * ownership is checked; the planning fields are filled in by the queue-specific stages.
 */
public final class AdmissionContext {

    private final Empire empire;
    private final Location location;
    private final CatalogSpec spec;
    private final List<BaseRecord> records;
    private final String identityKey;
    private final int quantity;
    private final Instant now;

    private int targetLevel = 1;
    private long creditsCost;
    private CapacityResult capacity;
    private EnergyProjection energy;

    AdmissionContext(Empire empire, Location location, CatalogSpec spec, List<BaseRecord> records,
                     String identityKey, int quantity, Instant now) {
        this.empire = empire;
        this.location = location;
        this.spec = spec;
        this.records = List.copyOf(records);
        this.identityKey = identityKey;
        this.quantity = quantity;
        this.now = now;
    }

    public Empire empire() {
        return empire;
    }

    public Location location() {
        return location;
    }

    public CatalogSpec spec() {
        return spec;
    }

    public List<BaseRecord> records() {
        return records;
    }

    public String identityKey() {
        return identityKey;
    }

    public int quantity() {
        return quantity;
    }

    public Instant now() {
        return now;
    }

    public int targetLevel() {
        return targetLevel;
    }

    void setTargetLevel(int targetLevel) {
        this.targetLevel = targetLevel;
    }

    public long creditsCost() {
        return creditsCost;
    }

    void setCreditsCost(long creditsCost) {
        this.creditsCost = creditsCost;
    }

    public CapacityResult capacity() {
        return capacity;
    }

    void setCapacity(CapacityResult capacity) {
        this.capacity = capacity;
    }

    public EnergyProjection energy() {
        return energy;
    }

    void setEnergy(EnergyProjection energy) {
        this.energy = energy;
    }
}
