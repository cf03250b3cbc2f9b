package uk.gegc.formbatch.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import uk.gegc.formbatch.BaseIntegrationTest;
import uk.gegc.formbatch.features.account.application.AccountService;
import uk.gegc.formbatch.features.audit.domain.model.ActivityLogEntry;
import uk.gegc.formbatch.features.audit.domain.repository.ActivityLogRepository;
import uk.gegc.formbatch.features.billing.api.dto.BalanceDto;
import uk.gegc.formbatch.features.billing.api.dto.CommitResult;
import uk.gegc.formbatch.features.billing.api.dto.ReservationResult;
import uk.gegc.formbatch.features.billing.api.dto.TransactionDto;
import uk.gegc.formbatch.features.billing.application.CreditLedgerService;
import uk.gegc.formbatch.features.billing.domain.exception.CommitExceedsReservedException;
import uk.gegc.formbatch.features.billing.domain.exception.InsufficientCreditsException;
import uk.gegc.formbatch.features.billing.domain.exception.ReservationNotActiveException;
import uk.gegc.formbatch.features.billing.domain.model.CreditPool;
import uk.gegc.formbatch.features.billing.domain.model.CreditTransaction;
import uk.gegc.formbatch.features.billing.domain.model.CreditTransactionType;
import uk.gegc.formbatch.features.billing.domain.model.Reservation;
import uk.gegc.formbatch.features.billing.domain.model.ReservationState;
import uk.gegc.formbatch.features.billing.infra.repository.CreditTransactionRepository;
import uk.gegc.formbatch.features.billing.infra.repository.ReservationRepository;
import uk.gegc.formbatch.shared.exception.ForbiddenException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Credit ledger against the database")
class CreditLedgerServiceIntegrationTest extends BaseIntegrationTest {

    static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-00000000ad01");

    @Autowired
    private CreditLedgerService ledger;

    @Autowired
    private AccountService accountService;

    @Autowired
    private ReservationRepository reservationRepository;

    @Autowired
    private CreditTransactionRepository transactionRepository;

    @Autowired
    private ActivityLogRepository activityLogRepository;

    @Autowired
    private Clock clock;

    private UUID accountId;

    @BeforeEach
    void openAccount() {
        // pro tier: 1000 monthly credits
        accountId = accountService.openAccount("pro", 0L).id();
    }

    private void fund(long rollover, long topup) {
        if (rollover > 0) {
            ledger.adjustCredits(accountId, CreditPool.ROLLOVER, rollover, "test funding", ADMIN_ID);
        }
        if (topup > 0) {
            ledger.adjustCredits(accountId, CreditPool.TOPUP, topup, "test funding", ADMIN_ID);
        }
    }

    @Nested
    @DisplayName("reserve")
    class Reserve {

        @Test
        @DisplayName("holds credits from monthly before the other pools")
        void holdsInDrawOrder() {
            fund(200, 300);

            ReservationResult result = ledger.reserve(accountId, 1100, null);

            assertThat(result.state()).isEqualTo(ReservationState.ACTIVE);
            assertThat(result.monthlyReserved()).isEqualTo(1000);
            assertThat(result.rolloverReserved()).isEqualTo(100);
            assertThat(result.topupReserved()).isZero();

            BalanceDto balance = ledger.getBalance(accountId);
            assertThat(balance.monthlyCredits()).isZero();
            assertThat(balance.rolloverCredits()).isEqualTo(100);
            assertThat(balance.topupCredits()).isEqualTo(300);
        }

        @Test
        @DisplayName("rejects a shortfall without touching any pool")
        void rejectsShortfall() {
            assertThatThrownBy(() -> ledger.reserve(accountId, 1001, null))
                    .isInstanceOfSatisfying(InsufficientCreditsException.class, ice -> {
                        assertThat(ice.getRequiredCredits()).isEqualTo(1001);
                        assertThat(ice.getAvailableCredits()).isEqualTo(1000);
                        assertThat(ice.getShortfall()).isEqualTo(1);
                    });

            assertThat(ledger.getBalance(accountId).totalCredits()).isEqualTo(1000);
            assertThat(transactionRepository.findByAccountIdAndType(accountId, CreditTransactionType.RESERVE)).isEmpty();
        }

        @Test
        @DisplayName("a repeated reserve for the same job returns the first reservation")
        void idempotentPerJob() {
            UUID jobId = UUID.randomUUID();

            ReservationResult first = ledger.reserve(accountId, 40, jobId);
            ReservationResult second = ledger.reserve(accountId, 40, jobId);

            assertThat(second.reservationId()).isEqualTo(first.reservationId());
            assertThat(ledger.getBalance(accountId).totalCredits()).isEqualTo(960);
            assertThat(transactionRepository.findByAccountIdAndType(accountId, CreditTransactionType.RESERVE)).hasSize(1);
        }

        @Test
        @DisplayName("concurrent reservations never overdraw the account")
        void concurrentReservesNeverOverdraw() throws Exception {
            int threads = 10;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    Callable<Boolean> attempt = () -> {
                        start.await();
                        try {
                            ledger.reserve(accountId, 150, null);
                            return true;
                        } catch (InsufficientCreditsException e) {
                            return false;
                        }
                    };
                    futures.add(pool.submit(attempt));
                }
                start.countDown();

                int succeeded = 0;
                for (Future<Boolean> future : futures) {
                    try {
                        if (future.get(60, TimeUnit.SECONDS)) {
                            succeeded++;
                        }
                    } catch (ExecutionException e) {
                        throw new AssertionError("Unexpected failure in concurrent reserve", e.getCause());
                    }
                }

                assertThat(succeeded).isEqualTo(6);
                BalanceDto balance = ledger.getBalance(accountId);
                assertThat(balance.totalCredits()).isEqualTo(100);
                assertThat(reservationRepository.findByAccountIdAndState(accountId, ReservationState.ACTIVE)).hasSize(6);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("commit and release")
    class Finalize {

        @Test
        @DisplayName("charges the actual amount and refunds the rest to the pools it came from")
        void commitRefundsUnused() {
            fund(200, 300);
            ReservationResult reservation = ledger.reserve(accountId, 1300, null);

            // drew 1000 monthly, 200 rollover, 100 top-up; 400 unused goes back top-up first
            CommitResult result = ledger.commit(reservation.reservationId(), 900);

            assertThat(result.state()).isEqualTo(ReservationState.COMMITTED);
            assertThat(result.committedCredits()).isEqualTo(900);
            assertThat(result.refundedCredits()).isEqualTo(400);
            assertThat(result.monthlyCharged()).isEqualTo(900);
            assertThat(result.rolloverCharged()).isZero();
            assertThat(result.topupCharged()).isZero();

            BalanceDto balance = ledger.getBalance(accountId);
            assertThat(balance.monthlyCredits()).isEqualTo(100);
            assertThat(balance.rolloverCredits()).isEqualTo(200);
            assertThat(balance.topupCredits()).isEqualTo(300);
            assertThat(balance.creditsUsedTotal()).isEqualTo(900);
            assertThat(balance.totalRuns()).isEqualTo(1);
        }

        @Test
        @DisplayName("a repeated identical commit returns the recorded result without charging again")
        void commitReplay() {
            ReservationResult reservation = ledger.reserve(accountId, 10, null);

            CommitResult first = ledger.commit(reservation.reservationId(), 7);
            CommitResult again = ledger.commit(reservation.reservationId(), 7);

            assertThat(again).isEqualTo(first);
            assertThat(ledger.getBalance(accountId).totalCredits()).isEqualTo(993);
            assertThat(transactionRepository.findByReservationIdOrderByCreatedAtAsc(reservation.reservationId()))
                    .extracting(CreditTransaction::getType)
                    .containsExactlyInAnyOrder(CreditTransactionType.RESERVE, CreditTransactionType.COMMIT);
        }

        @Test
        @DisplayName("a different commit on a finalized reservation is rejected")
        void conflictingCommitRejected() {
            ReservationResult reservation = ledger.reserve(accountId, 10, null);
            ledger.commit(reservation.reservationId(), 7);

            assertThatThrownBy(() -> ledger.commit(reservation.reservationId(), 5))
                    .isInstanceOf(ReservationNotActiveException.class);
        }

        @Test
        @DisplayName("commit above the reserved amount is rejected and leaves the reservation active")
        void commitAboveEstimate() {
            ReservationResult reservation = ledger.reserve(accountId, 10, null);

            assertThatThrownBy(() -> ledger.commit(reservation.reservationId(), 11))
                    .isInstanceOf(CommitExceedsReservedException.class);

            Reservation stored = reservationRepository.findById(reservation.reservationId()).orElseThrow();
            assertThat(stored.getState()).isEqualTo(ReservationState.ACTIVE);
        }

        @Test
        @DisplayName("release returns everything")
        void releaseReturnsAll() {
            ReservationResult reservation = ledger.reserve(accountId, 250, null);

            CommitResult result = ledger.release(reservation.reservationId());

            assertThat(result.state()).isEqualTo(ReservationState.RELEASED);
            assertThat(result.refundedCredits()).isEqualTo(250);
            BalanceDto balance = ledger.getBalance(accountId);
            assertThat(balance.totalCredits()).isEqualTo(1000);
            assertThat(balance.totalRuns()).isZero();
        }
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        @DisplayName("the sweeper returns credits held past their TTL")
        void sweeperExpiresStaleReservations() {
            ReservationResult reservation = ledger.reserve(accountId, 300, null);
            Reservation stored = reservationRepository.findById(reservation.reservationId()).orElseThrow();
            stored.setExpiresAt(LocalDateTime.now(clock).minusMinutes(1));
            reservationRepository.save(stored);

            int expired = ledger.expireReservations();

            assertThat(expired).isGreaterThanOrEqualTo(1);
            assertThat(reservationRepository.findById(reservation.reservationId()).orElseThrow().getState())
                    .isEqualTo(ReservationState.EXPIRED);
            assertThat(ledger.getBalance(accountId).totalCredits()).isEqualTo(1000);
            assertThat(activityLogRepository.findByTargetAccountIdAndActivityType(
                    accountId, ActivityLogEntry.ActivityType.RESERVATION_EXPIRED)).hasSize(1);

            assertThatThrownBy(() -> ledger.commit(reservation.reservationId(), 100))
                    .isInstanceOf(ReservationNotActiveException.class);
        }

        @Test
        @DisplayName("an extended hold survives the sweeper and can still be charged")
        void extendedReservationNotExpired() {
            ReservationResult reservation = ledger.reserve(accountId, 300, null);
            Reservation stored = reservationRepository.findById(reservation.reservationId()).orElseThrow();
            stored.setExpiresAt(LocalDateTime.now(clock).minusMinutes(1));
            reservationRepository.save(stored);

            assertThat(ledger.extendReservation(reservation.reservationId())).isTrue();
            assertThat(reservationRepository.findById(reservation.reservationId()).orElseThrow().getExpiresAt())
                    .isAfter(LocalDateTime.now(clock));

            ledger.expireReservations();

            assertThat(reservationRepository.findById(reservation.reservationId()).orElseThrow().getState())
                    .isEqualTo(ReservationState.ACTIVE);
            CommitResult result = ledger.commit(reservation.reservationId(), 120);
            assertThat(result.committedCredits()).isEqualTo(120);
            assertThat(ledger.getBalance(accountId).totalCredits()).isEqualTo(880);
        }

        @Test
        @DisplayName("leaves a fresh hold untouched")
        void freshReservationNotRewritten() {
            ReservationResult reservation = ledger.reserve(accountId, 50, null);
            Reservation before = reservationRepository.findById(reservation.reservationId()).orElseThrow();

            assertThat(ledger.extendReservation(reservation.reservationId())).isTrue();

            Reservation after = reservationRepository.findById(reservation.reservationId()).orElseThrow();
            assertThat(after.getExpiresAt()).isEqualTo(before.getExpiresAt());
            assertThat(after.getVersion()).isEqualTo(before.getVersion());
        }

        @Test
        @DisplayName("reports a finalized hold as no longer extendable")
        void finalizedReservationNotExtended() {
            ReservationResult reservation = ledger.reserve(accountId, 50, null);
            ledger.release(reservation.reservationId());

            assertThat(ledger.extendReservation(reservation.reservationId())).isFalse();
        }
    }

    @Nested
    @DisplayName("administrative adjustment")
    class Adjust {

        @Test
        @DisplayName("requires the admin capability")
        void nonAdminForbidden() {
            assertThatThrownBy(() -> ledger.adjustCredits(accountId, CreditPool.TOPUP, 10, "gift", accountId))
                    .isInstanceOf(ForbiddenException.class);
            assertThat(ledger.getBalance(accountId).topupCredits()).isZero();
        }

        @Test
        @DisplayName("cannot take a pool below zero")
        void negativeResultRejected() {
            assertThatThrownBy(() -> ledger.adjustCredits(accountId, CreditPool.ROLLOVER, -1, "correction", ADMIN_ID))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("requires a reason")
        void reasonRequired() {
            assertThatThrownBy(() -> ledger.adjustCredits(accountId, CreditPool.TOPUP, 5, " ", ADMIN_ID))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("journals the change and records an audit entry")
        void journaledAndAudited() {
            BalanceDto balance = ledger.adjustCredits(accountId, CreditPool.TOPUP, 50, "goodwill", ADMIN_ID);

            assertThat(balance.topupCredits()).isEqualTo(50);
            List<TransactionDto> history = ledger.listTransactions(accountId, PageRequest.of(0, 10)).getContent();
            assertThat(history).hasSize(1);
            assertThat(history.get(0).type()).isEqualTo(CreditTransactionType.ADJUSTMENT);
            assertThat(history.get(0).topupDelta()).isEqualTo(50);
            assertThat(history.get(0).actorId()).isEqualTo(ADMIN_ID);
            assertThat(history.get(0).reason()).isEqualTo("goodwill");

            List<ActivityLogEntry> audit = activityLogRepository.findByTargetAccountIdAndActivityType(
                    accountId, ActivityLogEntry.ActivityType.CREDITS_ADJUSTED);
            assertThat(audit).hasSize(1);
            assertThat(audit.get(0).getActorId()).isEqualTo(ADMIN_ID);
            assertThat(audit.get(0).getReason()).isEqualTo("goodwill");
            assertThat(audit.get(0).getChangesJson()).contains("topupCredits");
        }
    }

    @Nested
    @DisplayName("monthly renewal")
    class Renewal {

        @Test
        @DisplayName("rolls unused monthly credits over and refills the allowance")
        void rollsOverAndRefills() {
            ReservationResult reservation = ledger.reserve(accountId, 400, null);
            ledger.commit(reservation.reservationId(), 400);

            BalanceDto renewed = ledger.renewMonthlyAllowance(accountId);

            assertThat(renewed.monthlyCredits()).isEqualTo(1000);
            assertThat(renewed.rolloverCredits()).isEqualTo(600);
            assertThat(renewed.creditsUsedThisPeriod()).isZero();
            assertThat(renewed.creditsUsedTotal()).isEqualTo(400);
            assertThat(activityLogRepository.findByTargetAccountIdAndActivityType(
                    accountId, ActivityLogEntry.ActivityType.MONTHLY_ALLOWANCE_RENEWED)).hasSize(1);
        }
    }
}
