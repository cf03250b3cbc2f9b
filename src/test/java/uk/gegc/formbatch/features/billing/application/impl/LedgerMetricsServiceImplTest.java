package uk.gegc.formbatch.features.billing.application.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.formbatch.features.billing.domain.model.CreditPool;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerMetricsServiceImplTest {

    private SimpleMeterRegistry registry;
    private LedgerMetricsServiceImpl metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new LedgerMetricsServiceImpl(registry);
    }

    @Test
    @DisplayName("commit counts the charge and the refund separately")
    void commitCountsChargeAndRefund() {
        metrics.incrementReservationCreated(10);
        metrics.incrementReservationCommitted(7, 3);

        assertThat(registry.get("ledger.reservations.created").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("ledger.credits.reserved").counter().count()).isEqualTo(10.0);
        assertThat(registry.get("ledger.credits.charged").counter().count()).isEqualTo(7.0);
        assertThat(registry.get("ledger.credits.refunded").counter().count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("adjustments are tagged by pool and direction")
    void adjustmentsTagged() {
        metrics.incrementCreditsAdjusted(CreditPool.TOPUP, 50);
        metrics.incrementCreditsAdjusted(CreditPool.TOPUP, -20);
        metrics.incrementCreditsAdjusted(CreditPool.MONTHLY, 5);

        assertThat(registry.get("ledger.credits.adjusted").tags("pool", "topup", "direction", "credit")
                .counter().count()).isEqualTo(50.0);
        assertThat(registry.get("ledger.credits.adjusted").tags("pool", "topup", "direction", "debit")
                .counter().count()).isEqualTo(20.0);
        assertThat(registry.get("ledger.credits.adjusted").tags("pool", "monthly")
                .counter().count()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("sweeper backlog gauge reflects the last run")
    void sweeperBacklogGauge() {
        metrics.recordSweeperBacklog(4);
        metrics.recordSweeperBacklog(1);

        assertThat(registry.get("ledger.sweeper.backlog").gauge().value()).isEqualTo(1.0);
    }
}
