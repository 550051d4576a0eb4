package org.attrition.engine.status;

import org.attrition.engine.GameEngine;
import org.attrition.engine.admission.AdmissionRequest;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.model.QueueType;
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

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.attrition.testutils.GameTestSupport.BASE;
import static org.attrition.testutils.GameTestSupport.EMPIRE;
import static org.attrition.testutils.GameTestSupport.OTHER_EMPIRE;
import static org.attrition.testutils.GameTestSupport.START;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class StatusServiceTest {

    private H2GameStore store;
    private MutableClock clock;
    private GameEngine engine;

    @BeforeEach
    void setUp() {
        store = GameTestSupport.newStore("status");
        clock = new MutableClock(START);
        engine = GameTestSupport.newEngine(store, clock);
        GameTestSupport.ownBase(store, EMPIRE, 100, Map.of("laser", 1));
        GameTestSupport.structure(store, "urban_structures", 4);
        GameTestSupport.structure(store, "research_labs", 2);
        GameTestSupport.structure(store, "shipyards", 1);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private void start(QueueType type, String key) {
        engine.getAdmissions().start(type, EMPIRE, AdmissionRequest.of(BASE, key));
    }

    @Test
    void baseStatsDerivesFromRecords() {
        BaseStats stats = engine.getStatus().baseStats(EMPIRE, BASE);

        assertThat(stats.energy().produced()).isEqualTo(2);
        assertThat(stats.energy().consumed()).isEqualTo(3);
        assertThat(stats.energy().balance()).isEqualTo(-1);
        // urban 4, labs 2, shipyards 1
        assertThat(stats.area().used()).isEqualTo(7);
        assertThat(stats.area().capacity()).isEqualTo(85);
        assertThat(stats.population().capacity()).isEqualTo(20);
        assertThat(stats.population().used()).isEqualTo(3);
        assertThat(stats.capacities().research().value()).isCloseTo(16.8, within(1e-9));
        assertThat(stats.capacities().citizen().value()).isCloseTo(12.0, within(1e-9));
    }

    @Test
    @DisplayName("The queue lists in-flight records in admission order, then live entries")
    void baseQueueOrder() {
        start(QueueType.STRUCTURES, "solar_plants");
        start(QueueType.DEFENSES, "barracks");
        start(QueueType.STRUCTURES, "gas_plants");
        clock.advance(Duration.ofSeconds(1));
        start(QueueType.RESEARCH, "energy");

        List<QueuedItemView> queue = engine.getStatus().baseQueue(EMPIRE, BASE);

        assertThat(queue).extracting(v -> v.item().catalogKey())
            .containsExactly("solar_plants", "barracks", "gas_plants", "energy");
        assertThat(queue).extracting(v -> v.item().status())
            .containsExactly("active", "active", "queued", "active");
        assertThat(queue.get(0).energy().projectedEnergy()).isEqualTo(2);
        assertThat(queue.get(3).energy()).isNull();
    }

    @Test
    void empireViewReportsIncomeAndUnits() {
        start(QueueType.UNITS, "fighters");
        clock.advance(Duration.ofMinutes(148));
        engine.getGameLoop().runOnce();

        EmpireView view = engine.getStatus().empireView(EMPIRE);

        assertThat(view.incomePerHour()).isEqualTo(1);
        assertThat(view.units()).containsEntry(BASE, Map.of("fighters", 1L));
    }

    @Test
    void foreignBaseIsNotOwner() {
        store.saveEmpire(GameTestSupport.empire(OTHER_EMPIRE, 0, Map.of()));

        assertThatThrownBy(() -> engine.getStatus().baseStats(OTHER_EMPIRE, BASE))
            .isInstanceOfSatisfying(GameException.class, e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_OWNER));
    }

    @Test
    void unknownEmpireIsNotFound() {
        assertThatThrownBy(() -> engine.getStatus().empireView("nobody"))
            .isInstanceOfSatisfying(GameException.class, e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_FOUND));
    }
}
