package uk.gegc.formbatch.features.account.api.dto;

import uk.gegc.formbatch.features.limits.api.dto.CustomLimitsRequest;

import java.time.LocalDateTime;
import java.util.UUID;

public record AccountDto(
        UUID id,
        String tierKey,
        long monthlyCredits,
        long rolloverCredits,
        long topupCredits,
        long creditsUsedTotal,
        long creditsUsedThisPeriod,
        long totalRuns,
        CustomLimitsRequest customLimits,
        String customLimitsReason,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
