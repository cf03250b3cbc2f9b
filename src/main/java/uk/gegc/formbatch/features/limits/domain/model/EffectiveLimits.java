package uk.gegc.formbatch.features.limits.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Fully resolved limits for one account at one point in time. Embedded on a batch job
 * as the snapshot the job validated against.
 */
@Embeddable
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class EffectiveLimits {

    @Column(name = "limit_tier_key", length = 50)
    private String tierKey;

    @Column(name = "limit_max_template_file_bytes")
    private long maxTemplateFileBytes;

    @Column(name = "limit_max_data_file_bytes")
    private long maxDataFileBytes;

    @Column(name = "limit_max_rows_per_batch")
    private int maxRowsPerBatch;

    @Column(name = "limit_can_save_templates")
    private boolean canSaveTemplates;

    @Column(name = "limit_can_use_api")
    private boolean canUseApi;

    @Column(name = "limit_priority_processing")
    private boolean priorityProcessing;

    @Column(name = "limit_max_saved_templates")
    private int maxSavedTemplates;

    @Column(name = "limit_max_total_storage_mb")
    private long maxTotalStorageMb;

    @Column(name = "limit_customized")
    private boolean customized;

    /**
     * Tier defaults with each present override field taking precedence.
     */
    public static EffectiveLimits of(Tier tier, CustomLimits override) {
        EffectiveLimitsBuilder builder = EffectiveLimits.builder()
                .tierKey(tier.getTierKey())
                .maxTemplateFileBytes(tier.getMaxTemplateFileBytes())
                .maxDataFileBytes(tier.getMaxDataFileBytes())
                .maxRowsPerBatch(tier.getMaxRowsPerBatch())
                .canSaveTemplates(tier.isCanSaveTemplates())
                .canUseApi(tier.isCanUseApi())
                .priorityProcessing(tier.isPriorityProcessing())
                .maxSavedTemplates(tier.getMaxSavedTemplates())
                .maxTotalStorageMb(tier.getMaxTotalStorageMb())
                .customized(false);

        if (override == null || override.getReason() == null) {
            return builder.build();
        }

        if (override.getMaxTemplateFileBytes() != null) {
            builder.maxTemplateFileBytes(override.getMaxTemplateFileBytes());
        }
        if (override.getMaxDataFileBytes() != null) {
            builder.maxDataFileBytes(override.getMaxDataFileBytes());
        }
        if (override.getMaxRowsPerBatch() != null) {
            builder.maxRowsPerBatch(override.getMaxRowsPerBatch());
        }
        if (override.getCanSaveTemplates() != null) {
            builder.canSaveTemplates(override.getCanSaveTemplates());
        }
        if (override.getCanUseApi() != null) {
            builder.canUseApi(override.getCanUseApi());
        }
        if (override.getPriorityProcessing() != null) {
            builder.priorityProcessing(override.getPriorityProcessing());
        }
        if (override.getMaxSavedTemplates() != null) {
            builder.maxSavedTemplates(override.getMaxSavedTemplates());
        }
        if (override.getMaxTotalStorageMb() != null) {
            builder.maxTotalStorageMb(override.getMaxTotalStorageMb());
        }
        return builder.customized(true).build();
    }
}
