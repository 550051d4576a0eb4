package org.attrition.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.attrition.engine.admission.AdmissionDependencies;
import org.attrition.engine.admission.EnergyFeasibilityGate;
import org.attrition.engine.admission.IdentityGuard;
import org.attrition.engine.admission.QueueAdmissions;
import org.attrition.engine.api.services.IService;
import org.attrition.engine.api.store.IGameStore;
import org.attrition.engine.capacity.CapacityBaselines;
import org.attrition.engine.capacity.CapacityService;
import org.attrition.engine.catalog.Catalog;
import org.attrition.engine.economy.EconomyService;
import org.attrition.engine.ledger.ResourceLedger;
import org.attrition.engine.resources.store.H2GameStore;
import org.attrition.engine.scheduling.CancellationService;
import org.attrition.engine.scheduling.ConstructionScheduler;
import org.attrition.engine.seed.SeedLoader;
import org.attrition.engine.services.gameloop.GameLoopService;
import org.attrition.engine.services.gameloop.TickProcessor;
import org.attrition.engine.status.StatusService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the engine around one store. Reads these option blocks:
 * <ul>
 *     <li>{@code store}: {@link H2GameStore} options</li>
 *     <li>{@code gameLoop}: {@code intervalMs}, {@code pendingGraceSeconds}, {@code autoStart}</li>
 *     <li>{@code capacity}: see {@link CapacityBaselines#fromConfig(Config)}</li>
 *     <li>{@code energy.baselineProduction}</li>
 *     <li>{@code seed}: see {@link SeedLoader}</li>
 * </ul>
 */
public final class GameEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    private final IGameStore store;
    private final QueueAdmissions admissions;
    private final CancellationService cancellation;
    private final StatusService status;
    private final GameLoopService gameLoop;
    private final boolean autoStart;

    public GameEngine(IGameStore store, Config options, Clock clock) {
        this.store = store;
        Config gameLoopOptions = options.hasPath("gameLoop") ? options.getConfig("gameLoop") : ConfigFactory.empty();
        Config capacityOptions = options.hasPath("capacity") ? options.getConfig("capacity") : ConfigFactory.empty();
        int baselineEnergy = options.hasPath("energy.baselineProduction")
            ? options.getInt("energy.baselineProduction") : 2;
        Duration pendingGrace = Duration.ofSeconds(gameLoopOptions.hasPath("pendingGraceSeconds")
            ? gameLoopOptions.getLong("pendingGraceSeconds") : 30);

        Catalog catalog = new Catalog();
        ResourceLedger ledger = new ResourceLedger(catalog, baselineEnergy);
        CapacityService capacityService = new CapacityService(store, ledger, CapacityBaselines.fromConfig(capacityOptions));
        EnergyFeasibilityGate gate = new EnergyFeasibilityGate();
        ConstructionScheduler scheduler = new ConstructionScheduler(store, capacityService, clock);
        EconomyService economy = new EconomyService(store, ledger);

        this.admissions = new QueueAdmissions(new AdmissionDependencies(store, catalog, ledger, capacityService, gate,
            new IdentityGuard(clock), scheduler, clock));
        this.cancellation = new CancellationService(store, scheduler);
        this.status = new StatusService(store, ledger, capacityService, gate, economy);
        this.gameLoop = new GameLoopService("gameLoop", gameLoopOptions,
            new TickProcessor(store, capacityService, scheduler, economy, clock, pendingGrace));
        this.autoStart = !gameLoopOptions.hasPath("autoStart") || gameLoopOptions.getBoolean("autoStart");

        if (options.hasPath("seed")) {
            SeedLoader.load(store, options.getConfig("seed"), clock.instant());
        }
    }

    /**
     * Creates an engine backed by an {@link H2GameStore} built from {@code options.store}.
     */
    public static GameEngine create(Config options) {
        H2GameStore store = new H2GameStore("store", options.getConfig("store"));
        try {
            return new GameEngine(store, options, Clock.systemUTC());
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
    }

    public IGameStore getStore() {
        return store;
    }

    public QueueAdmissions getAdmissions() {
        return admissions;
    }

    public CancellationService getCancellation() {
        return cancellation;
    }

    public StatusService getStatus() {
        return status;
    }

    public GameLoopService getGameLoop() {
        return gameLoop;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    @Override
    public void close() {
        IService.State state = gameLoop.getCurrentState();
        if (state == IService.State.RUNNING || state == IService.State.PAUSED) {
            gameLoop.stop();
        }
        if (store instanceof AutoCloseable) {
            try {
                ((AutoCloseable) store).close();
            } catch (Exception e) {
                log.warn("Failed to close store: {}", e.getMessage());
            }
        }
    }
}
