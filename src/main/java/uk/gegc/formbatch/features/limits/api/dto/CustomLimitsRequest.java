package uk.gegc.formbatch.features.limits.api.dto;

import lombok.Builder;
import uk.gegc.formbatch.features.limits.domain.model.CustomLimits;

/**
 * Override values an administrator wants to apply. Null fields keep the tier value.
 */
@Builder(toBuilder = true)
public record CustomLimitsRequest(
        Long maxTemplateFileBytes,
        Long maxDataFileBytes,
        Integer maxRowsPerBatch,
        Boolean canSaveTemplates,
        Boolean canUseApi,
        Boolean priorityProcessing,
        Integer maxSavedTemplates,
        Long maxTotalStorageMb
) {

    public boolean isEmpty() {
        return maxTemplateFileBytes == null
                && maxDataFileBytes == null
                && maxRowsPerBatch == null
                && canSaveTemplates == null
                && canUseApi == null
                && priorityProcessing == null
                && maxSavedTemplates == null
                && maxTotalStorageMb == null;
    }

    public static CustomLimitsRequest from(CustomLimits limits) {
        if (limits == null) {
            return null;
        }
        return new CustomLimitsRequest(
                limits.getMaxTemplateFileBytes(),
                limits.getMaxDataFileBytes(),
                limits.getMaxRowsPerBatch(),
                limits.getCanSaveTemplates(),
                limits.getCanUseApi(),
                limits.getPriorityProcessing(),
                limits.getMaxSavedTemplates(),
                limits.getMaxTotalStorageMb()
        );
    }
}
