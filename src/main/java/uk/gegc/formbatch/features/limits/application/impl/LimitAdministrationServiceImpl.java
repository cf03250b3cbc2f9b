package uk.gegc.formbatch.features.limits.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.formbatch.features.account.domain.model.Account;
import uk.gegc.formbatch.features.account.domain.repository.AccountRepository;
import uk.gegc.formbatch.features.audit.api.dto.AuditEntry;
import uk.gegc.formbatch.features.audit.domain.events.ActivityRecordedEvent;
import uk.gegc.formbatch.features.audit.domain.model.ActivityLogEntry;
import uk.gegc.formbatch.features.limits.api.dto.CustomLimitsRequest;
import uk.gegc.formbatch.features.limits.application.CustomLimitTemplate;
import uk.gegc.formbatch.features.limits.application.LimitAdministrationService;
import uk.gegc.formbatch.features.limits.domain.exception.InvalidLimitOverrideException;
import uk.gegc.formbatch.features.limits.domain.model.CustomLimits;
import uk.gegc.formbatch.features.limits.domain.model.EffectiveLimits;
import uk.gegc.formbatch.features.limits.domain.model.Tier;
import uk.gegc.formbatch.features.limits.domain.repository.TierRepository;
import uk.gegc.formbatch.shared.exception.ResourceNotFoundException;
import uk.gegc.formbatch.shared.security.AccessPolicy;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class LimitAdministrationServiceImpl implements LimitAdministrationService {

    private final AccountRepository accountRepository;
    private final TierRepository tierRepository;
    private final AccessPolicy accessPolicy;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    @Transactional
    public EffectiveLimits setCustomLimits(UUID accountId, CustomLimitsRequest limits, String reason, UUID actorId) {
        accessPolicy.requireAdmin(actorId);
        validate(limits, reason);

        Account account = loadAccount(accountId);
        CustomLimitsRequest before = account.hasCustomLimits() ? CustomLimitsRequest.from(account.getCustomLimits()) : null;

        account.setCustomLimits(CustomLimits.builder()
                .maxTemplateFileBytes(limits.maxTemplateFileBytes())
                .maxDataFileBytes(limits.maxDataFileBytes())
                .maxRowsPerBatch(limits.maxRowsPerBatch())
                .canSaveTemplates(limits.canSaveTemplates())
                .canUseApi(limits.canUseApi())
                .priorityProcessing(limits.priorityProcessing())
                .maxSavedTemplates(limits.maxSavedTemplates())
                .maxTotalStorageMb(limits.maxTotalStorageMb())
                .reason(reason.trim())
                .setBy(actorId)
                .createdAt(LocalDateTime.now(clock))
                .build());
        accountRepository.save(account);

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("before", before);
        changes.put("after", limits);

        publish(AuditEntry.builder()
                .category(ActivityLogEntry.Category.LIMITS)
                .activityType(ActivityLogEntry.ActivityType.CUSTOM_LIMITS_SET)
                .actorType(ActivityLogEntry.ActorType.ADMIN)
                .actorId(actorId)
                .targetAccountId(accountId)
                .action("admin_set_custom_limits")
                .description("Custom limits set for account " + accountId)
                .reason(reason.trim())
                .changes(changes)
                .relatedTierKey(account.getTierKey())
                .build());

        log.info("Custom limits set for account {} by {}: {}", accountId, actorId, limits);
        return resolveFor(account);
    }

    @Override
    @Transactional
    public EffectiveLimits clearCustomLimits(UUID accountId, UUID actorId) {
        accessPolicy.requireAdmin(actorId);
        Account account = loadAccount(accountId);

        if (!account.hasCustomLimits()) {
            log.debug("No custom limits to clear for account {}", accountId);
            return resolveFor(account);
        }

        CustomLimits previous = account.getCustomLimits();
        account.setCustomLimits(null);
        accountRepository.save(account);

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("before", CustomLimitsRequest.from(previous));
        changes.put("after", null);

        publish(AuditEntry.builder()
                .category(ActivityLogEntry.Category.LIMITS)
                .activityType(ActivityLogEntry.ActivityType.CUSTOM_LIMITS_CLEARED)
                .actorType(ActivityLogEntry.ActorType.ADMIN)
                .actorId(actorId)
                .targetAccountId(accountId)
                .action("admin_remove_custom_limits")
                .description("Custom limits removed for account " + accountId)
                .reason(previous.getReason())
                .changes(changes)
                .relatedTierKey(account.getTierKey())
                .build());

        log.info("Custom limits cleared for account {} by {}", accountId, actorId);
        return resolveFor(account);
    }

    @Override
    @Transactional
    public EffectiveLimits changeTier(UUID accountId, String tierKey, String reason, UUID actorId) {
        accessPolicy.requireAdmin(actorId);
        Tier tier = tierRepository.findByTierKeyAndActiveTrue(tierKey)
                .orElseThrow(() -> new ResourceNotFoundException("Active tier not found: " + tierKey));
        Account account = loadAccount(accountId);

        String previousTier = account.getTierKey();
        boolean hadCustomLimits = account.hasCustomLimits();

        account.setTierKey(tier.getTierKey());
        account.setCustomLimits(null);
        accountRepository.save(account);

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("tierKey", Map.of("old", previousTier, "new", tier.getTierKey()));
        changes.put("customLimitsCleared", hadCustomLimits);

        publish(AuditEntry.builder()
                .category(ActivityLogEntry.Category.SUBSCRIPTION)
                .activityType(ActivityLogEntry.ActivityType.TIER_CHANGED)
                .actorType(ActivityLogEntry.ActorType.ADMIN)
                .actorId(actorId)
                .targetAccountId(accountId)
                .action("subscription_changed")
                .description("Tier changed from " + previousTier + " to " + tier.getTierKey())
                .reason(reason)
                .changes(changes)
                .relatedTierKey(tier.getTierKey())
                .build());

        log.info("Account {} moved from tier {} to {} by {} (custom limits cleared: {})",
                accountId, previousTier, tier.getTierKey(), actorId, hadCustomLimits);
        return EffectiveLimits.of(tier, null);
    }

    @Override
    @Transactional
    public EffectiveLimits applyTemplate(UUID accountId, CustomLimitTemplate template, String reason, UUID actorId) {
        if (template == null) {
            throw new InvalidLimitOverrideException("Template is required");
        }
        String finalReason = reason == null || reason.isBlank()
                ? "Applied " + template.name().toLowerCase() + " template"
                : reason;
        return setCustomLimits(accountId, template.getLimits(), finalReason, actorId);
    }

    private void validate(CustomLimitsRequest limits, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new InvalidLimitOverrideException("A reason is required when setting custom limits");
        }
        if (limits == null || limits.isEmpty()) {
            throw new InvalidLimitOverrideException("At least one limit must be overridden");
        }
        requirePositive("maxTemplateFileBytes", limits.maxTemplateFileBytes());
        requirePositive("maxDataFileBytes", limits.maxDataFileBytes());
        requirePositive("maxRowsPerBatch", limits.maxRowsPerBatch());
        requirePositive("maxSavedTemplates", limits.maxSavedTemplates());
        requirePositive("maxTotalStorageMb", limits.maxTotalStorageMb());
    }

    private void requirePositive(String field, Number value) {
        if (value != null && value.longValue() <= 0) {
            throw new InvalidLimitOverrideException(field + " must be positive");
        }
    }

    private Account loadAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account not found: " + accountId));
    }

    private EffectiveLimits resolveFor(Account account) {
        Tier tier = tierRepository.findByTierKey(account.getTierKey())
                .orElseThrow(() -> new ResourceNotFoundException("Tier not found: " + account.getTierKey()));
        return EffectiveLimits.of(tier, account.getCustomLimits());
    }

    private void publish(AuditEntry entry) {
        eventPublisher.publishEvent(new ActivityRecordedEvent(this, entry));
    }
}
