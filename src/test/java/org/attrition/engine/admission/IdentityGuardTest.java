package org.attrition.engine.admission;

import org.attrition.engine.api.store.IdentityConflictException;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.model.QueueItem;
import org.attrition.engine.model.QueueType;
import org.attrition.testutils.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class IdentityGuardTest {

    private static final String KEY = "empire-1:A00:10:20:10:energy";
    private static final Instant STARTED = Instant.parse("2026-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(STARTED);
    private final IdentityGuard guard = new IdentityGuard(clock);

    private static QueueItem live(long id) {
        return new QueueItem(id, QueueType.RESEARCH, "A00:10:20:10", "energy", 1, 1, "active", 2, KEY,
            STARTED, STARTED.plusSeconds(480));
    }

    @Test
    void admitsWhenNothingIsLive() {
        String written = guard.admit(QueueType.RESEARCH, KEY, "energy", Optional::empty, () -> "written");

        assertThat(written).isEqualTo("written");
    }

    @Test
    @DisplayName("A live item is reported with its remaining time, without writing")
    void preCheck_reportsLiveItem() {
        AtomicInteger writes = new AtomicInteger();
        clock.advance(Duration.ofSeconds(180));

        assertThatThrownBy(() -> guard.admit(QueueType.RESEARCH, KEY, "energy",
            () -> Optional.of(live(42)), writes::incrementAndGet))
            .isInstanceOfSatisfying(GameException.class, e -> {
                assertThat(e.getCode()).isEqualTo(ErrorCode.ALREADY_IN_PROGRESS);
                assertThat(e.getDetails())
                    .containsEntry("queueType", "research")
                    .containsEntry("identityKey", KEY)
                    .containsEntry("catalogKey", "energy");
                @SuppressWarnings("unchecked")
                Map<String, Object> existing = (Map<String, Object>) e.getDetails().get("existing");
                assertThat(existing)
                    .containsEntry("_id", "42")
                    .containsEntry("state", "active")
                    .containsEntry("startedAt", STARTED.toString())
                    .containsEntry("etaSeconds", 300L);
            });
        assertThat(writes).hasValue(0);
    }

    @Test
    @DisplayName("An overdue live item reports no time left")
    void overdueItem_reportsZeroRemaining() {
        clock.advance(Duration.ofMinutes(9));

        assertThatThrownBy(() -> guard.admit(QueueType.RESEARCH, KEY, "energy",
            () -> Optional.of(live(42)), () -> "written"))
            .isInstanceOfSatisfying(GameException.class, e -> {
                @SuppressWarnings("unchecked")
                Map<String, Object> existing = (Map<String, Object>) e.getDetails().get("existing");
                assertThat(existing).containsEntry("etaSeconds", 0L);
            });
    }

    @Test
    @DisplayName("A lost race is reported with the winner, never as a storage error")
    void lostRace_isRemappedToAlreadyInProgress() {
        AtomicInteger probes = new AtomicInteger();

        assertThatThrownBy(() -> guard.admit(QueueType.RESEARCH, KEY, "energy",
            () -> probes.incrementAndGet() == 1 ? Optional.empty() : Optional.of(live(7)),
            () -> {
                throw new IdentityConflictException(KEY, null);
            }))
            .isInstanceOfSatisfying(GameException.class, e -> {
                assertThat(e.getCode()).isEqualTo(ErrorCode.ALREADY_IN_PROGRESS);
                @SuppressWarnings("unchecked")
                Map<String, Object> existing = (Map<String, Object>) e.getDetails().get("existing");
                assertThat(existing).containsEntry("_id", "7");
            });
        assertThat(probes).hasValue(2);
    }
}
