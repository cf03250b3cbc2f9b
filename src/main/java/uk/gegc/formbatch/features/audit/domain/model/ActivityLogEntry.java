package uk.gegc.formbatch.features.audit.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only activity record. Rows are inserted once and never updated or deleted.
 */
@Entity
@Immutable
@Table(name = "activity_log", indexes = {
        @Index(name = "idx_activity_log_target_created", columnList = "target_account_id, created_at"),
        @Index(name = "idx_activity_log_job", columnList = "related_job_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class ActivityLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 30)
    private Category category;

    @Enumerated(EnumType.STRING)
    @Column(name = "activity_type", nullable = false, length = 50)
    private ActivityType activityType;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_type", nullable = false, length = 20)
    private ActorType actorType;

    @Column(name = "actor_id")
    private UUID actorId;

    @Column(name = "target_account_id")
    private UUID targetAccountId;

    @Column(name = "action", nullable = false, length = 100)
    private String action;

    @Column(name = "description", nullable = false, length = 1000)
    private String description;

    @Column(name = "reason", length = 500)
    private String reason;

    @Column(name = "changes_json", length = 4000)
    private String changesJson;

    @Column(name = "metadata_json", length = 4000)
    private String metadataJson;

    @Column(name = "related_job_id")
    private UUID relatedJobId;

    @Column(name = "related_tier_key", length = 50)
    private String relatedTierKey;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public enum Category {
        CREDITS,
        LIMITS,
        SUBSCRIPTION,
        JOB
    }

    public enum ActivityType {
        CREDITS_ADJUSTED,
        MONTHLY_ALLOWANCE_RENEWED,
        RESERVATION_EXPIRED,
        CUSTOM_LIMITS_SET,
        CUSTOM_LIMITS_CLEARED,
        TIER_CHANGED,
        JOB_COMPLETED,
        JOB_PARTIALLY_COMPLETED,
        JOB_FAILED
    }

    public enum ActorType {
        ACCOUNT,
        ADMIN,
        SYSTEM
    }
}
