package uk.gegc.formbatch.features.limits.application;

import uk.gegc.formbatch.features.limits.api.dto.CustomLimitsRequest;
import uk.gegc.formbatch.features.limits.domain.model.EffectiveLimits;

import java.util.UUID;

/**
 * Administrative changes to an account's limit configuration. Every method requires the
 * acting identity to hold the admin capability and returns the limits now in force.
 */
public interface LimitAdministrationService {

    EffectiveLimits setCustomLimits(UUID accountId, CustomLimitsRequest limits, String reason, UUID actorId);

    EffectiveLimits clearCustomLimits(UUID accountId, UUID actorId);

    /**
     * Moves the account to another tier. Any custom override is dropped.
     */
    EffectiveLimits changeTier(UUID accountId, String tierKey, String reason, UUID actorId);

    EffectiveLimits applyTemplate(UUID accountId, CustomLimitTemplate template, String reason, UUID actorId);
}
