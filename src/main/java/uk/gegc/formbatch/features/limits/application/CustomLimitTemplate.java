package uk.gegc.formbatch.features.limits.application;

import uk.gegc.formbatch.features.limits.api.dto.CustomLimitsRequest;

/**
 * Named override presets support staff apply to individual accounts.
 */
public enum CustomLimitTemplate {

    ENTERPRISE_TRIAL(CustomLimitsRequest.builder()
            .maxTemplateFileBytes(20L * 1024 * 1024)
            .maxDataFileBytes(5L * 1024 * 1024)
            .canSaveTemplates(true)
            .canUseApi(true)
            .build()),

    VVIP_CLIENT(CustomLimitsRequest.builder()
            .maxTemplateFileBytes(100L * 1024 * 1024)
            .maxDataFileBytes(25L * 1024 * 1024)
            .maxRowsPerBatch(5000)
            .canSaveTemplates(true)
            .canUseApi(true)
            .build()),

    BETA_TESTER(CustomLimitsRequest.builder()
            .canSaveTemplates(true)
            .build()),

    SUPPORT_TEAM(CustomLimitsRequest.builder()
            .maxTemplateFileBytes(50L * 1024 * 1024)
            .maxDataFileBytes(10L * 1024 * 1024)
            .canSaveTemplates(true)
            .canUseApi(true)
            .build());

    private final CustomLimitsRequest limits;

    CustomLimitTemplate(CustomLimitsRequest limits) {
        this.limits = limits;
    }

    public CustomLimitsRequest getLimits() {
        return limits;
    }
}
