package org.attrition.engine.admission;

import org.attrition.engine.api.store.IdentityConflictException;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.model.QueueItem;
import org.attrition.engine.model.QueueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Admits at most one live item per identity key.
 * <p>
 * The pre-check answers the common case; the store's uniqueness guarantee answers the race.
 * Both produce the same {@code ALREADY_IN_PROGRESS} failure describing the live item.
 */
public class IdentityGuard {

    private static final Logger log = LoggerFactory.getLogger(IdentityGuard.class);

    private final Clock clock;

    public IdentityGuard(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param type        queue the identity belongs to
     * @param identityKey identity key
     * @param catalogKey  requested catalog key
     * @param probe       looks up the live item holding the identity
     * @param write       persists the new item, throwing {@link IdentityConflictException} on a lost race
     * @return the result of {@code write}
     * @throws GameException {@code ALREADY_IN_PROGRESS} if the identity is held
     */
    public <T> T admit(QueueType type, String identityKey, String catalogKey,
                       Supplier<Optional<QueueItem>> probe, Supplier<T> write) {
        Optional<QueueItem> existing = probe.get();
        if (existing.isPresent()) {
            throw alreadyInProgress(type, identityKey, catalogKey, existing.get());
        }
        try {
            return write.get();
        } catch (IdentityConflictException e) {
            log.debug("Identity race lost for {}, reporting the winner", identityKey);
            throw alreadyInProgress(type, identityKey, catalogKey, probe.get().orElse(null));
        }
    }

    private GameException alreadyInProgress(QueueType type, String identityKey, String catalogKey,
                                                   QueueItem existing) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("queueType", type.wireName());
        details.put("identityKey", identityKey);
        details.put("catalogKey", catalogKey);
        details.put("existing", existing == null ? null : describe(existing));
        return new GameException(ErrorCode.ALREADY_IN_PROGRESS,
            "An item with the same identity is already in progress.", details);
    }

    private Map<String, Object> describe(QueueItem item) {
        Map<String, Object> existing = new LinkedHashMap<>();
        existing.put("_id", String.valueOf(item.id()));
        existing.put("state", item.status());
        existing.put("startedAt", item.startedAt() == null ? null : item.startedAt().toString());
        existing.put("etaSeconds", item.remainingSeconds(clock.instant()));
        existing.put("catalogKey", item.catalogKey());
        return existing;
    }
}
