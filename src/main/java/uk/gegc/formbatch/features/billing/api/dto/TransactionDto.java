package uk.gegc.formbatch.features.billing.api.dto;

import uk.gegc.formbatch.features.billing.domain.model.CreditTransactionType;

import java.time.LocalDateTime;
import java.util.UUID;

public record TransactionDto(
        UUID id,
        UUID accountId,
        CreditTransactionType type,
        long amount,
        long monthlyDelta,
        long rolloverDelta,
        long topupDelta,
        UUID reservationId,
        String idempotencyKey,
        String reason,
        UUID actorId,
        long balanceAfterMonthly,
        long balanceAfterRollover,
        long balanceAfterTopup,
        LocalDateTime createdAt
) {
}
