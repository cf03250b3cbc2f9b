package uk.gegc.formbatch.features.billing.api.dto;

import uk.gegc.formbatch.features.billing.domain.model.ReservationState;

import java.time.LocalDateTime;
import java.util.UUID;

public record ReservationResult(
        UUID reservationId,
        UUID accountId,
        UUID jobId,
        ReservationState state,
        long estimatedCredits,
        long monthlyReserved,
        long rolloverReserved,
        long topupReserved,
        LocalDateTime expiresAt
) {
}
