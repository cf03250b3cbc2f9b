package uk.gegc.formbatch.features.billing.application;

import uk.gegc.formbatch.features.billing.domain.model.CreditPool;

/**
 * Counters for ledger activity.
 */
public interface LedgerMetricsService {

    void incrementReservationCreated(long amount);
    void incrementReservationCommitted(long committed, long refunded);
    void incrementReservationReleased(long amount);
    void incrementReservationExpired(long amount);

    void incrementInsufficientCredits();
    void incrementCreditsAdjusted(CreditPool pool, long delta);
    void incrementLockRetry(String operation);

    void recordSweeperBacklog(int expiredReservations);
}
