package org.attrition.engine.admission;

import org.attrition.engine.GameEngine;
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

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.attrition.testutils.GameTestSupport.BASE;
import static org.attrition.testutils.GameTestSupport.EMPIRE;
import static org.attrition.testutils.GameTestSupport.START;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class UnitsServiceTest {

    private H2GameStore store;
    private GameEngine engine;

    @BeforeEach
    void setUp() {
        store = GameTestSupport.newStore("units");
        engine = GameTestSupport.newEngine(store, new MutableClock(START));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private AdmissionResult start(String key, Integer quantity) {
        return engine.getAdmissions().start(QueueType.UNITS, EMPIRE, new AdmissionRequest(BASE, key, quantity));
    }

    @Test
    @DisplayName("Units are paid for the whole batch up front")
    void batchIsPaidUpFront() {
        GameTestSupport.ownBase(store, EMPIRE, 100, Map.of("laser", 1));
        GameTestSupport.structure(store, "shipyards", 1);

        AdmissionResult result = start("fighters", 3);

        assertThat(result.queueItem().quantity()).isEqualTo(3);
        assertThat(result.queueItem().creditsCost()).isEqualTo(15);
        assertThat(result.queueItem().status()).isEqualTo("active");
        assertThat(result.etaMinutes()).isEqualTo(442);
        assertThat(result.message()).isEqualTo("3 x Fighters production started. ETA 442 minute(s).");
        assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(85);
    }

    @Test
    void shortfallIsReported() {
        GameTestSupport.ownBase(store, EMPIRE, 10, Map.of("laser", 1));
        GameTestSupport.structure(store, "shipyards", 1);

        assertThatThrownBy(() -> start("fighters", 3))
            .isInstanceOfSatisfying(GameException.class, e -> {
                assertThat(e.getCode()).isEqualTo(ErrorCode.INSUFFICIENT_RESOURCES);
                assertThat(e.getDetails())
                    .containsEntry("requiredCredits", 15L)
                    .containsEntry("availableCredits", 10L)
                    .containsEntry("shortfall", 5L);
            });
        assertThat(store.findLiveEntries(EMPIRE, QueueType.UNITS)).isEmpty();
        assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(10);
    }

    @Test
    void largerHullsNeedLargerShipyards() {
        GameTestSupport.ownBase(store, EMPIRE, 100, Map.of("energy", 2));
        GameTestSupport.structure(store, "shipyards", 1);

        assertThatThrownBy(() -> start("recycler", null))
            .isInstanceOfSatisfying(GameException.class, e -> {
                assertThat(e.getCode()).isEqualTo(ErrorCode.INSUFFICIENT_SHIPYARD);
                assertThat(e.getMessage()).isEqualTo("Requires Shipyard level 5 at this base (current 1).");
            });
    }

    @Test
    void quantityMustBePositive() {
        GameTestSupport.ownBase(store, EMPIRE, 100, Map.of("laser", 1));

        assertThatThrownBy(() -> start("fighters", 0))
            .isInstanceOfSatisfying(GameException.class, e -> {
                assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_REQUEST);
                assertThat(e.getDetails()).containsEntry("field", "quantity");
            });
    }

    @Test
    void withoutShipyardsThereIsNoProductionCapacity() {
        GameTestSupport.ownBase(store, EMPIRE, 100, Map.of("laser", 1));

        assertThatThrownBy(() -> start("fighters", 1))
            .isInstanceOfSatisfying(GameException.class, e -> {
                assertThat(e.getCode()).isEqualTo(ErrorCode.NO_CAPACITY);
                assertThat(e.getMessage()).isEqualTo("No production capacity at this base.");
            });
    }
}
