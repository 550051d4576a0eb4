package org.attrition.engine.economy;

import org.attrition.engine.api.store.IGameStore;
import org.attrition.engine.ledger.ResourceLedger;
import org.attrition.engine.model.Empire;
import org.attrition.engine.model.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Hourly income of an empire and its accrual.
 * <p>
 * Only whole credits are paid out. {@code lastIncomeAt} advances by the time those credits
 * represent, so fractions carry over to the next accrual instead of being lost.
 */
public class EconomyService {

    private static final Logger log = LoggerFactory.getLogger(EconomyService.class);
    private static final long MILLIS_PER_HOUR = 3_600_000L;

    private final IGameStore store;
    private final ResourceLedger ledger;

    public EconomyService(IGameStore store, ResourceLedger ledger) {
        this.store = store;
        this.ledger = ledger;
    }

    /**
     * Sum of {@code level * economy} over the structures at every base the empire owns.
     */
    public long incomePerHour(String empireId) {
        long income = 0;
        for (Location location : store.findLocationsOwnedBy(empireId)) {
            income += ledger.incomePerHour(store.findRecords(empireId, location.coord()));
        }
        return income;
    }

    /**
     * Accrues the income earned between {@code lastIncomeAt} and {@code now}.
     *
     * @return {@code true} if this call changed the empire
     */
    public boolean accrue(Empire empire, Instant now) {
        Instant last = empire.lastIncomeAt();
        if (!now.isAfter(last)) {
            return false;
        }
        long rate = incomePerHour(empire.id());
        if (rate <= 0) {
            return store.accrueIncome(empire.id(), 0, last, now);
        }
        long elapsedMs = Duration.between(last, now).toMillis();
        long gained = rate * elapsedMs / MILLIS_PER_HOUR;
        if (gained <= 0) {
            return false;
        }
        long advanceMs = (gained * MILLIS_PER_HOUR + rate - 1) / rate;
        boolean applied = store.accrueIncome(empire.id(), gained, last, last.plusMillis(advanceMs));
        if (applied) {
            log.debug("[Economy] accrued empire={} credits={} ratePerHour={}", empire.id(), gained, rate);
        }
        return applied;
    }
}
