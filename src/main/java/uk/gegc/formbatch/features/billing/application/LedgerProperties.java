package uk.gegc.formbatch.features.billing.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Credit ledger configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "ledger")
@Validated
@Data
public class LedgerProperties {

    /**
     * Reservation TTL in minutes before the sweeper expires it and returns the credits.
     * Must comfortably exceed the longest batch run.
     */
    @Positive
    private int reservationTtlMinutes = 240;

    /**
     * Interval between sweeper runs.
     */
    @Positive
    private long reservationSweeperMs = 60_000L;

    @Valid
    private Retry retry = new Retry();

    @Data
    public static class Retry {

        /**
         * Attempts per ledger write when the account row is contended.
         */
        @Min(1)
        private int maxAttempts = 4;

        /**
         * Base backoff; attempt n waits n times this.
         */
        @PositiveOrZero
        private long backoffMs = 25L;
    }
}
