package uk.gegc.formbatch.features.limits.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Named bundle of default limits and capability flags an account is subscribed to.
 */
@Entity
@Table(name = "tiers")
@Getter
@Setter
public class Tier {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tier_key", nullable = false, unique = true, length = 50)
    private String tierKey;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "max_template_file_bytes", nullable = false)
    private long maxTemplateFileBytes;

    @Column(name = "max_data_file_bytes", nullable = false)
    private long maxDataFileBytes;

    @Column(name = "max_rows_per_batch", nullable = false)
    private int maxRowsPerBatch;

    @Column(name = "can_save_templates", nullable = false)
    private boolean canSaveTemplates;

    @Column(name = "can_use_api", nullable = false)
    private boolean canUseApi;

    @Column(name = "priority_processing", nullable = false)
    private boolean priorityProcessing;

    @Column(name = "max_saved_templates", nullable = false)
    private int maxSavedTemplates;

    @Column(name = "max_total_storage_mb", nullable = false)
    private long maxTotalStorageMb;

    @Column(name = "monthly_credits", nullable = false)
    private long monthlyCredits;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    void prePersist() {
        LocalDateTime now = LocalDateTime.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
