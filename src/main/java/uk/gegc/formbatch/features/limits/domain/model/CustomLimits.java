package uk.gegc.formbatch.features.limits.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Per-account override of tier limits. A null field means "use the tier value".
 * The reason column is always populated while an override exists.
 */
@Embeddable
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CustomLimits {

    @Column(name = "custom_max_template_file_bytes")
    private Long maxTemplateFileBytes;

    @Column(name = "custom_max_data_file_bytes")
    private Long maxDataFileBytes;

    @Column(name = "custom_max_rows_per_batch")
    private Integer maxRowsPerBatch;

    @Column(name = "custom_can_save_templates")
    private Boolean canSaveTemplates;

    @Column(name = "custom_can_use_api")
    private Boolean canUseApi;

    @Column(name = "custom_priority_processing")
    private Boolean priorityProcessing;

    @Column(name = "custom_max_saved_templates")
    private Integer maxSavedTemplates;

    @Column(name = "custom_max_total_storage_mb")
    private Long maxTotalStorageMb;

    @Column(name = "custom_limits_reason", length = 500)
    private String reason;

    @Column(name = "custom_limits_set_by")
    private UUID setBy;

    @Column(name = "custom_limits_created_at")
    private LocalDateTime createdAt;
}
