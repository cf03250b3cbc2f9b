package uk.gegc.formbatch.features.account.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.formbatch.features.account.api.dto.AccountDto;
import uk.gegc.formbatch.features.account.application.AccountService;
import uk.gegc.formbatch.features.account.domain.model.Account;
import uk.gegc.formbatch.features.account.domain.repository.AccountRepository;
import uk.gegc.formbatch.features.account.infra.mapping.AccountMapper;
import uk.gegc.formbatch.features.limits.domain.model.Tier;
import uk.gegc.formbatch.features.limits.domain.repository.TierRepository;
import uk.gegc.formbatch.shared.exception.ResourceNotFoundException;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AccountServiceImpl implements AccountService {

    private final AccountRepository accountRepository;
    private final TierRepository tierRepository;
    private final AccountMapper accountMapper;

    @Override
    @Transactional
    public AccountDto openAccount(String tierKey, long initialTopupCredits) {
        if (initialTopupCredits < 0) {
            throw new IllegalArgumentException("initialTopupCredits must be >= 0");
        }
        Tier tier = tierRepository.findByTierKeyAndActiveTrue(tierKey)
                .orElseThrow(() -> new ResourceNotFoundException("Active tier not found: " + tierKey));

        Account account = new Account();
        account.setTierKey(tier.getTierKey());
        account.setMonthlyCredits(tier.getMonthlyCredits());
        account.setRolloverCredits(0L);
        account.setTopupCredits(initialTopupCredits);
        account = accountRepository.save(account);

        log.info("Opened account {} on tier {} (monthly={}, topup={})",
                account.getId(), tier.getTierKey(), tier.getMonthlyCredits(), initialTopupCredits);
        return accountMapper.toDto(account);
    }

    @Override
    @Transactional(readOnly = true)
    public AccountDto getAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .map(accountMapper::toDto)
                .orElseThrow(() -> new ResourceNotFoundException("Account not found: " + accountId));
    }
}
