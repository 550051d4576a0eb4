package org.attrition.engine.admission;

import org.attrition.engine.api.store.IGameStore;
import org.attrition.engine.capacity.CapacityService;
import org.attrition.engine.catalog.Catalog;
import org.attrition.engine.ledger.ResourceLedger;
import org.attrition.engine.scheduling.ConstructionScheduler;

import java.time.Clock;

/**
 * Collaborators shared by all admission pipelines.
 */
public record AdmissionDependencies(IGameStore store, Catalog catalog, ResourceLedger ledger,
                                    CapacityService capacityService, EnergyFeasibilityGate gate,
                                    IdentityGuard identityGuard, ConstructionScheduler scheduler, Clock clock) {
}
