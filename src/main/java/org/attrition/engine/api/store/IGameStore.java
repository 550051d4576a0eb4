package org.attrition.engine.api.store;

import org.attrition.engine.model.BaseRecord;
import org.attrition.engine.model.Empire;
import org.attrition.engine.model.Location;
import org.attrition.engine.model.QueueEntry;
import org.attrition.engine.model.QueueStatus;
import org.attrition.engine.model.QueueType;
import org.attrition.engine.model.RecordKind;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence contract of the engine.
 * <p>
 * Every mutating method is atomic on its own: conditional single-row updates report whether
 * they applied, and the few methods that pair a status change with its effect (tech level,
 * unit count, refund) run in one local transaction. Nothing here holds locks across calls.
 * Failures surface as {@link StoreException}; losing an identity race surfaces as
 * {@link IdentityConflictException}.
 */
public interface IGameStore {


    Optional<Empire> findEmpire(String empireId);

    List<Empire> listEmpires();

    /**
     * Inserts or replaces an empire including its tech levels.
     */
    void saveEmpire(Empire empire);

    /**
     * Subtracts credits if and only if the balance covers them.
     *
     * @return {@code true} if debited
     */
    boolean debitCredits(String empireId, long amount);

    void addCredits(String empireId, long amount);

    /**
     * Adds accrued income when {@code lastIncomeAt} still equals {@code expectedLastIncomeAt}.
     *
     * @return {@code true} if this call applied the accrual
     */
    boolean accrueIncome(String empireId, long amount, Instant expectedLastIncomeAt, Instant newLastIncomeAt);

    Map<String, Long> findUnitCounts(String empireId, String coord);


    Optional<Location> findLocation(String coord);

    List<Location> findLocationsOwnedBy(String empireId);

    void saveLocation(Location location);


    List<BaseRecord> findRecords(String empireId, String coord);

    Optional<BaseRecord> findRecord(long id);

    Optional<BaseRecord> findRecord(String empireId, String coord, RecordKind kind, String catalogKey);

    /**
     * Inserts a completed record. Used for seeding; ignored if the record already exists.
     */
    void seedRecord(String empireId, String coord, RecordKind kind, String catalogKey, int level);

    /**
     * Inserts a first construction (level 0, inactive).
     *
     * @throws IdentityConflictException if a record for the same empire, base, kind and key exists
     */
    BaseRecord insertConstruction(RecordKind kind, String empireId, String coord, String catalogKey,
                                  long creditsCost, String identityKey);

    /**
     * Moves an idle active record into a pending upgrade.
     *
     * @throws IdentityConflictException if the record is no longer idle
     */
    BaseRecord beginUpgrade(long recordId, long creditsCost, String identityKey);

    /**
     * Unscheduled in-flight records of one lane, in admission order.
     */
    List<BaseRecord> findUnscheduled(String empireId, String coord, RecordKind kind);

    /**
     * Started, not yet activated record of one lane.
     */
    Optional<BaseRecord> findInProgress(String empireId, String coord, RecordKind kind);

    /**
     * Claims the lane for the record and stamps its timestamps.
     *
     * @return {@code false} if the record is no longer unscheduled or the lane is taken
     */
    boolean claimLane(long recordId, Instant started, Instant completes);

    /**
     * Lanes that have at least one unscheduled record.
     */
    List<LaneKey> findLanesWithUnscheduled();

    List<BaseRecord> findDueRecords(Instant now);

    /**
     * Activates the in-flight change read in {@code due} at its target level and frees the lane.
     * Nothing happens if that change is no longer in flight, even when the record has since
     * started another one.
     *
     * @return {@code false} if the change was already completed, cancelled or superseded
     */
    boolean completeRecord(BaseRecord due);

    /**
     * Cancels the in-flight change of a record and refunds the empire in one transaction.
     * Upgrades revert to active at their current level; first constructions are deleted.
     *
     * A started change refunds its {@code creditsCost}; an unstarted one refunds nothing.
     *
     * @return the record as it was before cancellation, or empty if nothing was in flight
     */
    Optional<BaseRecord> cancelRecord(long recordId);


    /**
     * Inserts a live entry.
     *
     * @throws IdentityConflictException if a live entry holds the same identity key
     */
    QueueEntry insertEntry(QueueType type, String empireId, String coord, String catalogKey, int level,
                           int quantity, String identityKey, long creditsCost, Instant createdAt);

    Optional<QueueEntry> findEntry(long entryId);

    Optional<QueueEntry> findLiveEntry(String identityKey);

    List<QueueEntry> findLiveEntries(String empireId, QueueType type);

    List<QueueEntry> findLiveEntries(String empireId, String coord);

    /**
     * Sets a {@code PENDING} or {@code QUEUED} entry active and charged.
     *
     * @return {@code false} if the entry left those statuses
     */
    boolean activateEntry(long entryId, Instant startedAt, Instant completesAt);

    /**
     * Moves an entry from {@code from} to {@code to} without side effects.
     */
    boolean transitionEntry(long entryId, QueueStatus from, QueueStatus to);

    /**
     * Entries that wait for activation: {@code QUEUED}, or {@code PENDING} created before
     * {@code pendingBefore}, oldest first.
     */
    List<QueueEntry> findAwaitingActivation(QueueType type, Instant pendingBefore);

    List<QueueEntry> findDueEntries(QueueType type, Instant now);

    /**
     * Completes an active research entry and raises the tech level to at least its target,
     * in one transaction.
     *
     * @return {@code false} if the entry was no longer active
     */
    boolean completeResearch(long entryId);

    /**
     * Completes an active unit entry and adds its quantity to the base's unit count,
     * in one transaction.
     *
     * @return {@code false} if the entry was no longer active
     */
    boolean completeUnits(long entryId);

    /**
     * Cancels a live entry, refunding its cost if it was charged, in one transaction.
     *
     * @return the entry as it was before cancellation, or empty if it was already terminal
     */
    Optional<QueueEntry> cancelEntry(long entryId);

    /**
     * A construction lane: one kind of record at one base.
     */
    record LaneKey(String empireId, String coord, RecordKind kind) {
    }
}
