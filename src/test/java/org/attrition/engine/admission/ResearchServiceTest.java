package org.attrition.engine.admission;

import org.attrition.engine.GameEngine;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.model.QueueStatus;
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
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.attrition.testutils.GameTestSupport.BASE;
import static org.attrition.testutils.GameTestSupport.EMPIRE;
import static org.attrition.testutils.GameTestSupport.START;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class ResearchServiceTest {

    private H2GameStore store;
    private GameEngine engine;

    @BeforeEach
    void setUp() {
        store = GameTestSupport.newStore("research");
        engine = GameTestSupport.newEngine(store, new MutableClock(START));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private AdmissionResult start(String key) {
        return engine.getAdmissions().start(QueueType.RESEARCH, EMPIRE, AdmissionRequest.of(BASE, key));
    }

    @Test
    @DisplayName("Affordable research is charged and activated on admission")
    void affordableResearchStarts() {
        GameTestSupport.ownBase(store, EMPIRE, 100, Map.of());
        GameTestSupport.structure(store, "research_labs", 2);

        AdmissionResult result = start("energy");

        assertThat(result.capacityPerHour()).isCloseTo(16.8, within(1e-9));
        assertThat(result.queueItem().level()).isEqualTo(1);
        assertThat(result.queueItem().creditsCost()).isEqualTo(2);
        assertThat(result.queueItem().status()).isEqualTo("active");
        assertThat(result.queueItem().etaSeconds()).isEqualTo(Duration.ofMinutes(8).getSeconds());
        assertThat(result.message()).isEqualTo("Energy research started. ETA 8 minute(s).");
        assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(98);
    }

    @Test
    @DisplayName("Unaffordable research waits as queued without a debit")
    void unaffordableResearchQueues() {
        GameTestSupport.ownBase(store, EMPIRE, 0, Map.of());
        GameTestSupport.structure(store, "research_labs", 2);

        AdmissionResult result = start("energy");

        assertThat(result.queueItem().status()).isEqualTo(QueueStatus.QUEUED.wireName());
        assertThat(result.message()).isEqualTo("Energy research queued until credits are available.");
        assertThat(GameTestSupport.credits(store, EMPIRE)).isZero();
    }

    @Test
    void targetsLevelAboveResearched() {
        GameTestSupport.ownBase(store, EMPIRE, 100, Map.of("energy", 3));
        GameTestSupport.structure(store, "research_labs", 2);

        AdmissionResult result = start("energy");

        assertThat(result.queueItem().level()).isEqualTo(4);
        assertThat(result.queueItem().creditsCost()).isEqualTo(8);
    }

    @Test
    void oneLiveEntryPerTech() {
        GameTestSupport.ownBase(store, EMPIRE, 0, Map.of());
        GameTestSupport.structure(store, "research_labs", 2);
        start("energy");

        assertThatThrownBy(() -> start("energy"))
            .isInstanceOfSatisfying(GameException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.ALREADY_IN_PROGRESS));
    }

    @Test
    void advancedTechNeedsMoreLabs() {
        GameTestSupport.ownBase(store, EMPIRE, 100, Map.of("energy", 2));
        GameTestSupport.structure(store, "research_labs", 1);

        assertThatThrownBy(() -> start("laser"))
            .isInstanceOfSatisfying(GameException.class, e -> {
                assertThat(e.getCode()).isEqualTo(ErrorCode.INSUFFICIENT_LABS);
                assertThat(e.getMessage()).isEqualTo("Requires Research Labs level 2 at this base (current 1).");
            });
    }

    @Test
    void withoutLabsThereIsNoResearchCapacity() {
        GameTestSupport.ownBase(store, EMPIRE, 100, Map.of());

        assertThatThrownBy(() -> start("energy"))
            .isInstanceOfSatisfying(GameException.class, e -> {
                assertThat(e.getCode()).isEqualTo(ErrorCode.NO_CAPACITY);
                assertThat(e.getMessage()).isEqualTo("No research capacity at this base.");
            });
    }

    @Test
    void unknownEmpireIsNotFound() {
        GameTestSupport.ownBase(store, EMPIRE, 100, Map.of());

        assertThatThrownBy(() -> engine.getAdmissions().start(QueueType.RESEARCH, "nobody",
            AdmissionRequest.of(BASE, "energy")))
            .isInstanceOfSatisfying(GameException.class, e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_FOUND));
    }
}
