package org.attrition.engine.admission;

import org.attrition.engine.GameEngine;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.model.QueueType;
import org.attrition.engine.model.RecordKind;
import org.attrition.engine.resources.store.H2GameStore;
import org.attrition.junit.extensions.logging.LogWatchExtension;
import org.attrition.testutils.GameTestSupport;
import org.attrition.testutils.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.attrition.testutils.GameTestSupport.BASE;
import static org.attrition.testutils.GameTestSupport.EMPIRE;
import static org.attrition.testutils.GameTestSupport.START;

/**
 * Simultaneous starts of the same item: exactly one wins, every other caller is told what is
 * already in progress, and only the winner is charged.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class ConcurrentAdmissionTest {

    private static final int CALLERS = 8;

    private H2GameStore store;
    private GameEngine engine;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        store = GameTestSupport.newStore("concurrent");
        engine = GameTestSupport.newEngine(store, new MutableClock(START));
        executor = Executors.newFixedThreadPool(CALLERS);
        GameTestSupport.ownBase(store, EMPIRE, 100, Map.of());
        GameTestSupport.structure(store, "urban_structures", 4);
        GameTestSupport.structure(store, "research_labs", 2);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
        engine.close();
    }

    private List<Object> race(QueueType type, String key) throws InterruptedException {
        CountDownLatch ready = new CountDownLatch(CALLERS);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<AdmissionResult>> futures = new ArrayList<>();
        for (int i = 0; i < CALLERS; i++) {
            Callable<AdmissionResult> call = () -> {
                ready.countDown();
                go.await();
                return engine.getAdmissions().start(type, EMPIRE, AdmissionRequest.of(BASE, key));
            };
            futures.add(executor.submit(call));
        }
        ready.await(5, TimeUnit.SECONDS);
        go.countDown();

        List<Object> outcomes = new ArrayList<>();
        for (Future<AdmissionResult> future : futures) {
            try {
                outcomes.add(future.get(10, TimeUnit.SECONDS));
            } catch (ExecutionException e) {
                outcomes.add(e.getCause());
            } catch (TimeoutException e) {
                throw new AssertionError("Admission did not finish", e);
            }
        }
        return outcomes;
    }

    private static void assertOneWinner(List<Object> outcomes) {
        assertThat(outcomes).filteredOn(AdmissionResult.class::isInstance).hasSize(1);
        assertThat(outcomes).filteredOn(o -> !(o instanceof AdmissionResult))
            .hasSize(CALLERS - 1)
            .allSatisfy(o -> {
                assertThat(o).isInstanceOf(GameException.class);
                assertThat(((GameException) o).getCode()).isEqualTo(ErrorCode.ALREADY_IN_PROGRESS);
            });
    }

    @Test
    @DisplayName("Racing starts of one structure create one record and one charge")
    void structureRace() throws InterruptedException {
        assertOneWinner(race(QueueType.STRUCTURES, "solar_plants"));

        assertThat(store.findRecords(EMPIRE, BASE))
            .filteredOn(r -> r.kind() == RecordKind.STRUCTURE && r.catalogKey().equals("solar_plants"))
            .hasSize(1);
        assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(99);
    }

    @Test
    @DisplayName("Racing upgrades of one structure begin one upgrade")
    void upgradeRace() throws InterruptedException {
        assertOneWinner(race(QueueType.STRUCTURES, "urban_structures"));

        assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(92);
    }

    @Test
    @DisplayName("Racing starts of one tech create one live entry and one charge")
    void researchRace() throws InterruptedException {
        assertOneWinner(race(QueueType.RESEARCH, "energy"));

        assertThat(store.findLiveEntries(EMPIRE, QueueType.RESEARCH)).hasSize(1);
        assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(98);
    }

    @Test
    @DisplayName("Racing unit orders create one live entry and debit once")
    void unitRace() throws InterruptedException {
        store.saveEmpire(GameTestSupport.empire(EMPIRE, 100, Map.of("laser", 1)));
        GameTestSupport.structure(store, "shipyards", 1);

        assertOneWinner(race(QueueType.UNITS, "fighters"));

        assertThat(store.findLiveEntries(EMPIRE, QueueType.UNITS))
            .singleElement()
            .satisfies(entry -> assertThat(entry.charged()).isTrue());
        assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(95);
    }
}
