package uk.gegc.formbatch.features.billing.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;
import uk.gegc.formbatch.features.billing.application.LedgerMetricsService;
import uk.gegc.formbatch.features.billing.domain.model.CreditPool;

import java.util.concurrent.atomic.AtomicInteger;

@Service
public class LedgerMetricsServiceImpl implements LedgerMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter reservationCreatedCounter;
    private final Counter reservationCommittedCounter;
    private final Counter reservationReleasedCounter;
    private final Counter reservationExpiredCounter;
    private final Counter creditsReservedCounter;
    private final Counter creditsChargedCounter;
    private final Counter creditsRefundedCounter;
    private final Counter insufficientCreditsCounter;

    private final AtomicInteger sweeperBacklog = new AtomicInteger();

    public LedgerMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.reservationCreatedCounter = Counter.builder("ledger.reservations.created")
                .description("Number of credit reservations created")
                .register(meterRegistry);
        this.reservationCommittedCounter = Counter.builder("ledger.reservations.committed")
                .description("Number of credit reservations committed")
                .register(meterRegistry);
        this.reservationReleasedCounter = Counter.builder("ledger.reservations.released")
                .description("Number of credit reservations released in full")
                .register(meterRegistry);
        this.reservationExpiredCounter = Counter.builder("ledger.reservations.expired")
                .description("Number of credit reservations expired by the sweeper")
                .register(meterRegistry);
        this.creditsReservedCounter = Counter.builder("ledger.credits.reserved")
                .description("Credits placed on hold")
                .register(meterRegistry);
        this.creditsChargedCounter = Counter.builder("ledger.credits.charged")
                .description("Credits charged on commit")
                .register(meterRegistry);
        this.creditsRefundedCounter = Counter.builder("ledger.credits.refunded")
                .description("Credits returned to pools on commit, release or expiry")
                .register(meterRegistry);
        this.insufficientCreditsCounter = Counter.builder("ledger.reservations.rejected")
                .description("Reservations rejected for insufficient credits")
                .register(meterRegistry);

        meterRegistry.gauge("ledger.sweeper.backlog", sweeperBacklog);
    }

    @Override
    public void incrementReservationCreated(long amount) {
        reservationCreatedCounter.increment();
        creditsReservedCounter.increment(amount);
    }

    @Override
    public void incrementReservationCommitted(long committed, long refunded) {
        reservationCommittedCounter.increment();
        creditsChargedCounter.increment(committed);
        creditsRefundedCounter.increment(refunded);
    }

    @Override
    public void incrementReservationReleased(long amount) {
        reservationReleasedCounter.increment();
        creditsRefundedCounter.increment(amount);
    }

    @Override
    public void incrementReservationExpired(long amount) {
        reservationExpiredCounter.increment();
        creditsRefundedCounter.increment(amount);
    }

    @Override
    public void incrementInsufficientCredits() {
        insufficientCreditsCounter.increment();
    }

    @Override
    public void incrementCreditsAdjusted(CreditPool pool, long delta) {
        Counter.builder("ledger.credits.adjusted")
                .description("Credits added or removed by administrators")
                .tag("pool", pool.name().toLowerCase())
                .tag("direction", delta >= 0 ? "credit" : "debit")
                .register(meterRegistry)
                .increment(Math.abs(delta));
    }

    @Override
    public void incrementLockRetry(String operation) {
        Counter.builder("ledger.lock.retries")
                .description("Ledger writes retried after lock contention")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordSweeperBacklog(int expiredReservations) {
        sweeperBacklog.set(expiredReservations);
    }
}
