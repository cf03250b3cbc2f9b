package uk.gegc.formbatch.features.audit.api.dto;

import uk.gegc.formbatch.features.audit.domain.model.ActivityLogEntry;

import java.time.LocalDateTime;
import java.util.UUID;

public record ActivityLogEntryDto(
        UUID id,
        ActivityLogEntry.Category category,
        ActivityLogEntry.ActivityType activityType,
        ActivityLogEntry.ActorType actorType,
        UUID actorId,
        UUID targetAccountId,
        String action,
        String description,
        String reason,
        String changesJson,
        String metadataJson,
        UUID relatedJobId,
        String relatedTierKey,
        LocalDateTime createdAt
) {
}
