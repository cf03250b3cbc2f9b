package uk.gegc.formbatch.features.billing.api.dto;

import java.time.LocalDateTime;
import java.util.UUID;

public record BalanceDto(
        UUID accountId,
        long monthlyCredits,
        long rolloverCredits,
        long topupCredits,
        long totalCredits,
        long creditsUsedTotal,
        long creditsUsedThisPeriod,
        long totalRuns,
        LocalDateTime updatedAt
) {
}
