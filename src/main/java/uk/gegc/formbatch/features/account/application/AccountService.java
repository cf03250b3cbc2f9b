package uk.gegc.formbatch.features.account.application;

import uk.gegc.formbatch.features.account.api.dto.AccountDto;

import java.util.UUID;

public interface AccountService {

    /**
     * Creates the ledger row for a new customer with the tier's monthly allowance and
     * optional opening top-up balance.
     */
    AccountDto openAccount(String tierKey, long initialTopupCredits);

    AccountDto getAccount(UUID accountId);
}
