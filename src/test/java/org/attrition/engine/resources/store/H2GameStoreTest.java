package org.attrition.engine.resources.store;

import com.typesafe.config.ConfigFactory;
import org.attrition.engine.api.store.IGameStore;
import org.attrition.engine.api.store.IdentityConflictException;
import org.attrition.engine.model.BaseRecord;
import org.attrition.engine.model.Empire;
import org.attrition.engine.model.QueueEntry;
import org.attrition.engine.model.QueueStatus;
import org.attrition.engine.model.QueueType;
import org.attrition.engine.model.RecordKind;
import org.attrition.junit.extensions.logging.LogWatchExtension;
import org.attrition.testutils.GameTestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.attrition.testutils.GameTestSupport.BASE;
import static org.attrition.testutils.GameTestSupport.EMPIRE;
import static org.attrition.testutils.GameTestSupport.START;

/**
 * Storage contract of {@link H2GameStore}: conditional updates, uniqueness among live items
 * and the transactions that pair a status change with its effect.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class H2GameStoreTest {

    private static final String KEY = EMPIRE + ":" + BASE + ":";

    private H2GameStore store;

    @BeforeEach
    void setUp() {
        store = GameTestSupport.newStore("store-test");
        GameTestSupport.ownBase(store, EMPIRE, 100, Map.of("energy", 2));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void requiresJdbcUrl() {
        assertThatThrownBy(() -> new H2GameStore("broken", ConfigFactory.empty()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jdbcUrl");
    }

    @Test
    @DisplayName("Empires round-trip with their tech levels")
    void saveAndFindEmpire() {
        Empire empire = store.findEmpire(EMPIRE).orElseThrow();

        assertThat(empire.credits()).isEqualTo(100);
        assertThat(empire.techLevel("energy")).isEqualTo(2);
        assertThat(empire.lastIncomeAt()).isEqualTo(START);
        assertThat(store.findLocationsOwnedBy(EMPIRE)).extracting(l -> l.coord()).containsExactly(BASE);
    }

    @Nested
    class Credits {

        @Test
        @DisplayName("A debit only applies when the balance covers it")
        void debitIsConditional() {
            assertThat(store.debitCredits(EMPIRE, 60)).isTrue();
            assertThat(store.debitCredits(EMPIRE, 60)).isFalse();
            assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(40);
        }

        @Test
        @DisplayName("Income accrual applies once per observed lastIncomeAt")
        void accrueIncomeIsCompareAndSet() {
            Instant later = START.plusSeconds(3600);

            assertThat(store.accrueIncome(EMPIRE, 5, START, later)).isTrue();
            assertThat(store.accrueIncome(EMPIRE, 5, START, later)).isFalse();

            Empire empire = store.findEmpire(EMPIRE).orElseThrow();
            assertThat(empire.credits()).isEqualTo(105);
            assertThat(empire.lastIncomeAt()).isEqualTo(later);
        }
    }

    @Nested
    class Records {

        @Test
        @DisplayName("A second first construction of the same key is an identity conflict")
        void insertConstruction_isUniquePerKey() {
            store.insertConstruction(RecordKind.STRUCTURE, EMPIRE, BASE, "shipyards", 5, KEY + "shipyards");

            assertThatThrownBy(() ->
                store.insertConstruction(RecordKind.STRUCTURE, EMPIRE, BASE, "shipyards", 5, KEY + "shipyards"))
                .isInstanceOf(IdentityConflictException.class);
        }

        @Test
        @DisplayName("Only an idle record can begin an upgrade")
        void beginUpgrade_requiresIdleRecord() {
            store.seedRecord(EMPIRE, BASE, RecordKind.STRUCTURE, "research_labs", 2);
            BaseRecord labs = store.findRecord(EMPIRE, BASE, RecordKind.STRUCTURE, "research_labs").orElseThrow();

            BaseRecord upgrading = store.beginUpgrade(labs.id(), 5, KEY + "research_labs");

            assertThat(upgrading.pendingUpgrade()).isTrue();
            assertThat(upgrading.active()).isFalse();
            assertThat(upgrading.level()).isEqualTo(2);
            assertThat(upgrading.targetLevel()).isEqualTo(3);
            assertThatThrownBy(() -> store.beginUpgrade(labs.id(), 5, KEY + "research_labs"))
                .isInstanceOf(IdentityConflictException.class);
        }

        @Test
        @DisplayName("A lane holds one started record at a time")
        void claimLane_isExclusive() {
            BaseRecord first = store.insertConstruction(RecordKind.STRUCTURE, EMPIRE, BASE, "shipyards", 5, KEY + "shipyards");
            BaseRecord second = store.insertConstruction(RecordKind.STRUCTURE, EMPIRE, BASE, "solar_plants", 1, KEY + "solar_plants");
            BaseRecord defense = store.insertConstruction(RecordKind.DEFENSE, EMPIRE, BASE, "barracks", 5, KEY + "barracks");

            assertThat(store.findUnscheduled(EMPIRE, BASE, RecordKind.STRUCTURE))
                .extracting(BaseRecord::id).containsExactly(first.id(), second.id());
            assertThat(store.claimLane(first.id(), START, START.plusSeconds(60))).isTrue();
            assertThat(store.claimLane(second.id(), START, START.plusSeconds(60))).isFalse();
            assertThat(store.claimLane(defense.id(), START, START.plusSeconds(60))).isTrue();
            assertThat(store.findInProgress(EMPIRE, BASE, RecordKind.STRUCTURE)).map(BaseRecord::id).contains(first.id());
            assertThat(store.findLanesWithUnscheduled())
                .containsExactly(new IGameStore.LaneKey(EMPIRE, BASE, RecordKind.STRUCTURE));
        }

        @Test
        @DisplayName("Completing a record activates it once and frees the lane")
        void completeRecord_isIdempotent() {
            BaseRecord record = store.insertConstruction(RecordKind.STRUCTURE, EMPIRE, BASE, "shipyards", 5, KEY + "shipyards");
            store.claimLane(record.id(), START, START.plusSeconds(60));

            assertThat(store.findDueRecords(START.plusSeconds(59))).isEmpty();
            List<BaseRecord> due = store.findDueRecords(START.plusSeconds(60));
            assertThat(due).extracting(BaseRecord::id).containsExactly(record.id());
            assertThat(store.completeRecord(due.get(0))).isTrue();
            assertThat(store.completeRecord(due.get(0))).isFalse();

            BaseRecord done = store.findRecord(record.id()).orElseThrow();
            assertThat(done.active()).isTrue();
            assertThat(done.level()).isEqualTo(1);
            assertThat(done.creditsCost()).isZero();
            assertThat(store.findInProgress(EMPIRE, BASE, RecordKind.STRUCTURE)).isEmpty();
        }

        @Test
        @DisplayName("Cancelling a started first construction deletes it and refunds its cost")
        void cancelRecord_refundsStartedConstruction() {
            BaseRecord record = store.insertConstruction(RecordKind.STRUCTURE, EMPIRE, BASE, "shipyards", 5, KEY + "shipyards");
            store.debitCredits(EMPIRE, 5);
            store.claimLane(record.id(), START, START.plusSeconds(60));

            assertThat(store.cancelRecord(record.id())).map(BaseRecord::started).contains(true);
            assertThat(store.findRecord(record.id())).isEmpty();
            assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(100);
            assertThat(store.cancelRecord(record.id())).isEmpty();
        }
    }

    @Nested
    class Entries {

        private QueueEntry insertResearch(String tech) {
            return store.insertEntry(QueueType.RESEARCH, EMPIRE, BASE, tech, 3, 1, KEY + tech, 5, START);
        }

        @Test
        @DisplayName("Only one live entry may hold an identity key")
        void liveIdentityIsUnique() {
            QueueEntry entry = insertResearch("energy");

            assertThatThrownBy(() -> insertResearch("energy")).isInstanceOf(IdentityConflictException.class);
            assertThat(store.findLiveEntry(KEY + "energy")).map(QueueEntry::id).contains(entry.id());

            store.cancelEntry(entry.id());
            assertThat(store.findLiveEntry(KEY + "energy")).isEmpty();
            assertThat(insertResearch("energy").id()).isNotEqualTo(entry.id());
        }

        @Test
        @DisplayName("Completing research raises the tech level exactly once")
        void completeResearch_appliesOnce() {
            QueueEntry entry = insertResearch("energy");
            assertThat(store.activateEntry(entry.id(), START, START.plusSeconds(60))).isTrue();
            assertThat(store.activateEntry(entry.id(), START, START.plusSeconds(60))).isFalse();

            assertThat(store.completeResearch(entry.id())).isTrue();
            assertThat(store.completeResearch(entry.id())).isFalse();

            assertThat(store.findEmpire(EMPIRE).orElseThrow().techLevel("energy")).isEqualTo(3);
            assertThat(store.findEntry(entry.id()).orElseThrow().status()).isEqualTo(QueueStatus.COMPLETED);
        }

        @Test
        @DisplayName("Completing units adds the quantity to the base exactly once")
        void completeUnits_appliesOnce() {
            QueueEntry entry = store.insertEntry(QueueType.UNITS, EMPIRE, BASE, "fighters", 1, 4, KEY + "fighters", 20, START);
            store.activateEntry(entry.id(), START, START.plusSeconds(60));

            assertThat(store.completeUnits(entry.id())).isTrue();
            assertThat(store.completeUnits(entry.id())).isFalse();
            assertThat(store.completeResearch(entry.id())).isFalse();

            assertThat(store.findUnitCounts(EMPIRE, BASE)).containsEntry("fighters", 4L);
        }

        @Test
        @DisplayName("Cancelling refunds only charged entries and only once")
        void cancelEntry_refundsChargedEntries() {
            QueueEntry uncharged = insertResearch("energy");
            QueueEntry charged = insertResearch("computer");
            store.debitCredits(EMPIRE, 5);
            store.activateEntry(charged.id(), START, START.plusSeconds(60));

            assertThat(store.cancelEntry(uncharged.id())).map(QueueEntry::charged).contains(false);
            assertThat(store.cancelEntry(charged.id())).map(QueueEntry::charged).contains(true);
            assertThat(store.cancelEntry(charged.id())).isEmpty();

            assertThat(GameTestSupport.credits(store, EMPIRE)).isEqualTo(100);
        }

        @Test
        @DisplayName("Queued entries and stale pending entries await activation")
        void findAwaitingActivation() {
            QueueEntry pending = insertResearch("energy");
            QueueEntry queued = insertResearch("computer");
            store.transitionEntry(queued.id(), QueueStatus.PENDING, QueueStatus.QUEUED);

            assertThat(store.findAwaitingActivation(QueueType.RESEARCH, START.minusSeconds(30)))
                .extracting(QueueEntry::id).containsExactly(queued.id());
            assertThat(store.findAwaitingActivation(QueueType.RESEARCH, START))
                .extracting(QueueEntry::id).containsExactly(pending.id(), queued.id());
        }
    }

    @Test
    void reportsMetrics() {
        store.insertConstruction(RecordKind.STRUCTURE, EMPIRE, BASE, "shipyards", 5, KEY + "shipyards");
        assertThatThrownBy(() ->
            store.insertConstruction(RecordKind.STRUCTURE, EMPIRE, BASE, "shipyards", 5, KEY + "shipyards"))
            .isInstanceOf(IdentityConflictException.class);

        assertThat(store.getMetrics())
            .containsEntry("identity_conflicts", 1L)
            .containsKey("statements_executed");
        assertThat(store.isHealthy()).isTrue();
    }
}
