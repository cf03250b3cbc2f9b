package uk.gegc.formbatch.features.limits.application;

import uk.gegc.formbatch.features.limits.domain.model.EffectiveLimits;

import java.util.UUID;

/**
 * Resolves the limits that apply to an account right now. Results are never cached:
 * callers that need a stable view (a running job) keep their own copy.
 */
public interface LimitResolver {

    EffectiveLimits resolve(UUID accountId);
}
