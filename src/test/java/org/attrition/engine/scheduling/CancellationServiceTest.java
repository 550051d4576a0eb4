package org.attrition.engine.scheduling;

import org.attrition.engine.GameEngine;
import org.attrition.engine.admission.AdmissionRequest;
import org.attrition.engine.admission.AdmissionResult;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.model.BaseRecord;
import org.attrition.engine.model.QueueStatus;
import org.attrition.engine.model.QueueType;
import org.attrition.engine.model.RecordKind;
import org.attrition.engine.resources.store.H2GameStore;
import org.attrition.junit.extensions.logging.LogWatchExtension;
import org.attrition.testutils.GameTestSupport;
import org.attrition.testutils.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.attrition.testutils.GameTestSupport.BASE;
import static org.attrition.testutils.GameTestSupport.EMPIRE;
import static org.attrition.testutils.GameTestSupport.OTHER_EMPIRE;
import static org.attrition.testutils.GameTestSupport.START;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class CancellationServiceTest {

    private H2GameStore store;
    private GameEngine engine;

    @BeforeEach
    void setUp() {
        store = GameTestSupport.newStore("cancel");
        engine = GameTestSupport.newEngine(store, new MutableClock(START));
        GameTestSupport.ownBase(store, EMPIRE, 100, Map.of());
        GameTestSupport.structure(store, "urban_structures", 4);
        GameTestSupport.structure(store, "research_labs", 2);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private AdmissionResult start(QueueType type, String key) {
        return engine.getAdmissions().start(type, EMPIRE, AdmissionRequest.of(BASE, key));
    }

    private CancelResult cancel(QueueType type, long id) {
        return engine.getCancellation().cancel(type, EMPIRE, id);
    }

    @Nested
    class Records {

        @Test
        @DisplayName("A started upgrade reverts to its level and refunds its cost")
        void startedUpgradeIsRefunded() {
            AdmissionResult upgrade = start(QueueType.STRUCTURES, "urban_structures");
            assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(92);

            CancelResult result = cancel(QueueType.STRUCTURES, upgrade.queueItem().id());

            assertThat(result.revertedUpgrade()).isTrue();
            assertThat(result.deleted()).isFalse();
            assertThat(result.refundedCredits()).isEqualTo(8);
            assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(100);
            BaseRecord urban = store.findRecord(upgrade.queueItem().id()).orElseThrow();
            assertThat(urban.active()).isTrue();
            assertThat(urban.level()).isEqualTo(4);
        }

        @Test
        @DisplayName("An unstarted upgrade reverts without a refund")
        void unstartedUpgradeRefundsNothing() {
            start(QueueType.STRUCTURES, "solar_plants");
            AdmissionResult labs = start(QueueType.STRUCTURES, "research_labs");
            assertThat(labs.queueItem().status()).isEqualTo("queued");

            CancelResult result = cancel(QueueType.STRUCTURES, labs.queueItem().id());

            assertThat(result.revertedUpgrade()).isTrue();
            assertThat(result.refundedCredits()).isZero();
            assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(99);
        }

        @Test
        @DisplayName("Cancelling the running head deletes it and starts the next item")
        void cancellingHeadStartsNext() {
            AdmissionResult solar = start(QueueType.STRUCTURES, "solar_plants");
            AdmissionResult gas = start(QueueType.STRUCTURES, "gas_plants");

            CancelResult result = cancel(QueueType.STRUCTURES, solar.queueItem().id());

            assertThat(result.deleted()).isTrue();
            assertThat(result.refundedCredits()).isEqualTo(1);
            assertThat(store.findRecord(solar.queueItem().id())).isEmpty();
            assertThat(store.findInProgress(EMPIRE, BASE, RecordKind.STRUCTURE))
                .map(BaseRecord::id).contains(gas.queueItem().id());
        }

        @Test
        void secondCancelRefundsNothing() {
            AdmissionResult upgrade = start(QueueType.STRUCTURES, "urban_structures");
            cancel(QueueType.STRUCTURES, upgrade.queueItem().id());

            CancelResult again = cancel(QueueType.STRUCTURES, upgrade.queueItem().id());

            assertThat(again.refundedCredits()).isZero();
            assertThat(again.revertedUpgrade()).isFalse();
            assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(100);
        }

        @Test
        void deletedRecordIsNotFound() {
            AdmissionResult solar = start(QueueType.STRUCTURES, "solar_plants");
            cancel(QueueType.STRUCTURES, solar.queueItem().id());

            assertThatThrownBy(() -> cancel(QueueType.STRUCTURES, solar.queueItem().id()))
                .isInstanceOfSatisfying(GameException.class,
                    e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_FOUND));
        }

        @Test
        void recordOfAnotherQueueIsNotFound() {
            AdmissionResult solar = start(QueueType.STRUCTURES, "solar_plants");

            assertThatThrownBy(() -> cancel(QueueType.DEFENSES, solar.queueItem().id()))
                .isInstanceOfSatisfying(GameException.class,
                    e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_FOUND));
        }

        @Test
        void foreignEmpireIsNotOwner() {
            AdmissionResult solar = start(QueueType.STRUCTURES, "solar_plants");

            assertThatThrownBy(() -> engine.getCancellation().cancel(QueueType.STRUCTURES, OTHER_EMPIRE,
                solar.queueItem().id()))
                .isInstanceOfSatisfying(GameException.class,
                    e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_OWNER));
            assertThat(store.findRecord(solar.queueItem().id())).isPresent();
        }
    }

    @Nested
    class Entries {

        @Test
        void chargedResearchIsRefunded() {
            AdmissionResult energy = start(QueueType.RESEARCH, "energy");
            assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(98);

            CancelResult result = cancel(QueueType.RESEARCH, energy.queueItem().id());

            assertThat(result.refundedCredits()).isEqualTo(2);
            assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(100);
            assertThat(store.findEntry(energy.queueItem().id())).map(e -> e.status()).contains(QueueStatus.CANCELLED);
        }

        @Test
        void queuedResearchRefundsNothing() {
            store.saveEmpire(GameTestSupport.empire(EMPIRE, 0, Map.of()));
            AdmissionResult energy = start(QueueType.RESEARCH, "energy");

            CancelResult result = cancel(QueueType.RESEARCH, energy.queueItem().id());

            assertThat(result.refundedCredits()).isZero();
            assertThat(GameTestSupport.credits(store, EMPIRE)).isZero();
        }

        @Test
        @DisplayName("A cancelled tech can be started again")
        void cancelFreesIdentity() {
            AdmissionResult first = start(QueueType.RESEARCH, "energy");
            cancel(QueueType.RESEARCH, first.queueItem().id());

            AdmissionResult second = start(QueueType.RESEARCH, "energy");

            assertThat(second.queueItem().id()).isNotEqualTo(first.queueItem().id());
            assertThat(second.queueItem().level()).isEqualTo(1);
        }
    }
}
