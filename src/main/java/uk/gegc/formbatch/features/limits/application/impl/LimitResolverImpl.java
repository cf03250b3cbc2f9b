package uk.gegc.formbatch.features.limits.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.formbatch.features.account.domain.model.Account;
import uk.gegc.formbatch.features.account.domain.repository.AccountRepository;
import uk.gegc.formbatch.features.limits.application.LimitResolver;
import uk.gegc.formbatch.features.limits.domain.model.EffectiveLimits;
import uk.gegc.formbatch.features.limits.domain.model.Tier;
import uk.gegc.formbatch.features.limits.domain.repository.TierRepository;
import uk.gegc.formbatch.shared.exception.ResourceNotFoundException;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class LimitResolverImpl implements LimitResolver {

    private final AccountRepository accountRepository;
    private final TierRepository tierRepository;

    @Override
    @Transactional(readOnly = true)
    public EffectiveLimits resolve(UUID accountId) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account not found: " + accountId));
        Tier tier = tierRepository.findByTierKey(account.getTierKey())
                .orElseThrow(() -> new ResourceNotFoundException("Tier not found: " + account.getTierKey()));

        EffectiveLimits limits = EffectiveLimits.of(tier, account.getCustomLimits());
        log.debug("Resolved limits for account {}: tier={} customized={}", accountId, tier.getTierKey(), limits.isCustomized());
        return limits;
    }
}
