package uk.gegc.formbatch.features.audit.api.dto;

import lombok.Builder;
import uk.gegc.formbatch.features.audit.domain.model.ActivityLogEntry;

import java.util.Map;
import java.util.UUID;

/**
 * What a caller wants recorded. Maps are serialized to JSON on write.
 */
@Builder
public record AuditEntry(
        ActivityLogEntry.Category category,
        ActivityLogEntry.ActivityType activityType,
        ActivityLogEntry.ActorType actorType,
        UUID actorId,
        UUID targetAccountId,
        String action,
        String description,
        String reason,
        Map<String, Object> changes,
        Map<String, Object> metadata,
        UUID relatedJobId,
        String relatedTierKey
) {
}
