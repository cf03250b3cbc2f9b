package uk.gegc.formbatch.features.billing.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.formbatch.features.account.domain.repository.AccountRepository;
import uk.gegc.formbatch.features.billing.application.CreditLedgerService;

import java.util.List;
import java.util.UUID;

/**
 * Periodic ledger housekeeping: the reservation sweeper and the monthly allowance renewal.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerScheduler {

    private final CreditLedgerService creditLedgerService;
    private final AccountRepository accountRepository;

    @Scheduled(fixedDelayString = "#{@ledgerProperties.reservationSweeperMs}")
    public void sweepExpiredReservations() {
        try {
            int expired = creditLedgerService.expireReservations();
            if (expired > 0) {
                log.info("Reservation sweeper expired {} reservations", expired);
            }
        } catch (Exception e) {
            log.error("Error during reservation sweep", e);
        }
    }

    @Scheduled(cron = "${ledger.renewal.cron:0 0 0 1 * *}")
    public void renewMonthlyAllowances() {
        List<UUID> accountIds = accountRepository.findAllIds();
        log.info("Renewing monthly allowance for {} accounts", accountIds.size());
        int failed = 0;
        for (UUID accountId : accountIds) {
            try {
                creditLedgerService.renewMonthlyAllowance(accountId);
            } catch (Exception e) {
                failed++;
                log.error("Monthly renewal failed for account {}", accountId, e);
            }
        }
        if (failed > 0) {
            log.warn("Monthly renewal finished with {} failures out of {} accounts", failed, accountIds.size());
        }
    }
}
