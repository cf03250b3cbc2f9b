package uk.gegc.formbatch.features.limits.api.dto;

import java.util.UUID;

public record TierDto(
        UUID id,
        String tierKey,
        String displayName,
        String description,
        long maxTemplateFileBytes,
        long maxDataFileBytes,
        int maxRowsPerBatch,
        boolean canSaveTemplates,
        boolean canUseApi,
        boolean priorityProcessing,
        int maxSavedTemplates,
        long maxTotalStorageMb,
        long monthlyCredits,
        int displayOrder,
        boolean active
) {
}
