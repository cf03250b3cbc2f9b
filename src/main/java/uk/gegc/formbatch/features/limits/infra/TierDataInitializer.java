package uk.gegc.formbatch.features.limits.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.formbatch.features.limits.domain.model.Tier;
import uk.gegc.formbatch.features.limits.domain.repository.TierRepository;

/**
 * Seeds the default tier catalog at startup. Existing tiers are left untouched so that
 * administrative edits survive restarts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "formbatch.tiers", name = "seed-defaults", havingValue = "true", matchIfMissing = true)
public class TierDataInitializer implements CommandLineRunner {

    private static final long KB = 1024L;
    private static final long MB = 1024L * KB;

    private final TierRepository tierRepository;

    @Override
    @Transactional
    public void run(String... args) {
        long before = tierRepository.count();
        seed("anon", "Anonymous", "Internal tier for anonymous users (not displayed)",
                MB, 250 * KB, 10, 0L, false, false, false, 0, 0L, 0);
        seed("standard", "Standard", "Pay as you go with purchased credits",
                5 * MB, MB, 100, 0L, true, false, false, 5, 50L, 1);
        seed("pro", "Pro", "Monthly credit allowance with API access",
                20 * MB, 5 * MB, 500, 1000L, true, true, true, 50, 500L, 2);
        seed("enterprise", "Enterprise", "High volume processing for teams",
                100 * MB, 25 * MB, 5000, 10000L, true, true, true, 500, 5000L, 3);
        log.info("TierDataInitializer: tiers count before={} after={}", before, tierRepository.count());
    }

    private void seed(String tierKey, String displayName, String description,
                      long maxTemplateFileBytes, long maxDataFileBytes, int maxRowsPerBatch,
                      long monthlyCredits, boolean canSaveTemplates, boolean canUseApi,
                      boolean priorityProcessing, int maxSavedTemplates, long maxTotalStorageMb,
                      int displayOrder) {
        if (tierRepository.existsByTierKey(tierKey)) {
            return;
        }
        Tier tier = new Tier();
        tier.setTierKey(tierKey);
        tier.setDisplayName(displayName);
        tier.setDescription(description);
        tier.setMaxTemplateFileBytes(maxTemplateFileBytes);
        tier.setMaxDataFileBytes(maxDataFileBytes);
        tier.setMaxRowsPerBatch(maxRowsPerBatch);
        tier.setMonthlyCredits(monthlyCredits);
        tier.setCanSaveTemplates(canSaveTemplates);
        tier.setCanUseApi(canUseApi);
        tier.setPriorityProcessing(priorityProcessing);
        tier.setMaxSavedTemplates(maxSavedTemplates);
        tier.setMaxTotalStorageMb(maxTotalStorageMb);
        tier.setDisplayOrder(displayOrder);
        tier.setActive(true);
        tierRepository.save(tier);
        log.info("Seeded tier {}", tierKey);
    }
}
