package uk.gegc.formbatch.features.billing.api.dto;

import uk.gegc.formbatch.features.billing.domain.model.ReservationState;

import java.util.UUID;

/**
 * Outcome of finalizing a reservation: what was charged per pool and what went back.
 */
public record CommitResult(
        UUID reservationId,
        ReservationState state,
        long estimatedCredits,
        long committedCredits,
        long refundedCredits,
        long monthlyCharged,
        long rolloverCharged,
        long topupCharged
) {
}
