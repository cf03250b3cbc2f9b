package uk.gegc.formbatch.features.billing.domain.exception;

import java.util.UUID;

/**
 * The account's pools together hold less than the requested amount. Not transient:
 * callers must not retry.
 */
public class InsufficientCreditsException extends RuntimeException {

    private final UUID accountId;
    private final long requiredCredits;
    private final long availableCredits;
    private final long shortfall;

    public InsufficientCreditsException(UUID accountId, long requiredCredits, long availableCredits) {
        super("Insufficient credits. Required: " + requiredCredits + ", Available: " + availableCredits);
        this.accountId = accountId;
        this.requiredCredits = requiredCredits;
        this.availableCredits = availableCredits;
        this.shortfall = requiredCredits - availableCredits;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public long getRequiredCredits() {
        return requiredCredits;
    }

    public long getAvailableCredits() {
        return availableCredits;
    }

    public long getShortfall() {
        return shortfall;
    }
}
