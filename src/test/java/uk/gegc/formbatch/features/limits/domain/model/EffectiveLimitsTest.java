package uk.gegc.formbatch.features.limits.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EffectiveLimits")
class EffectiveLimitsTest {

    private static Tier tier() {
        Tier tier = new Tier();
        tier.setTierKey("standard");
        tier.setMaxTemplateFileBytes(5_000_000L);
        tier.setMaxDataFileBytes(1_000_000L);
        tier.setMaxRowsPerBatch(100);
        tier.setCanSaveTemplates(true);
        tier.setCanUseApi(false);
        tier.setPriorityProcessing(false);
        tier.setMaxSavedTemplates(5);
        tier.setMaxTotalStorageMb(50L);
        return tier;
    }

    @Test
    @DisplayName("an override without a reason is ignored")
    void overrideWithoutReasonIgnored() {
        CustomLimits override = CustomLimits.builder().maxRowsPerBatch(9999).build();

        EffectiveLimits limits = EffectiveLimits.of(tier(), override);

        assertThat(limits.getMaxRowsPerBatch()).isEqualTo(100);
        assertThat(limits.isCustomized()).isFalse();
    }

    @Test
    @DisplayName("present override fields replace tier values, including false flags")
    void presentFieldsWin() {
        CustomLimits override = CustomLimits.builder()
                .maxDataFileBytes(42L)
                .canSaveTemplates(false)
                .reason("restricted")
                .build();

        EffectiveLimits limits = EffectiveLimits.of(tier(), override);

        assertThat(limits.getMaxDataFileBytes()).isEqualTo(42L);
        assertThat(limits.isCanSaveTemplates()).isFalse();
        assertThat(limits.getMaxTemplateFileBytes()).isEqualTo(5_000_000L);
        assertThat(limits.getMaxRowsPerBatch()).isEqualTo(100);
        assertThat(limits.isCustomized()).isTrue();
    }
}
