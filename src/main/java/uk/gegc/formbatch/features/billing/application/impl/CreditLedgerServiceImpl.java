package uk.gegc.formbatch.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.formbatch.features.account.domain.model.Account;
import uk.gegc.formbatch.features.account.domain.repository.AccountRepository;
import uk.gegc.formbatch.features.audit.api.dto.AuditEntry;
import uk.gegc.formbatch.features.audit.domain.events.ActivityRecordedEvent;
import uk.gegc.formbatch.features.audit.domain.model.ActivityLogEntry;
import uk.gegc.formbatch.features.billing.api.dto.BalanceDto;
import uk.gegc.formbatch.features.billing.api.dto.CommitResult;
import uk.gegc.formbatch.features.billing.api.dto.ReservationResult;
import uk.gegc.formbatch.features.billing.api.dto.TransactionDto;
import uk.gegc.formbatch.features.billing.application.CreditLedgerService;
import uk.gegc.formbatch.features.billing.application.LedgerMetricsService;
import uk.gegc.formbatch.features.billing.application.LedgerProperties;
import uk.gegc.formbatch.features.billing.application.LedgerStructuredLogger;
import uk.gegc.formbatch.features.billing.domain.exception.CommitExceedsReservedException;
import uk.gegc.formbatch.features.billing.domain.exception.InsufficientCreditsException;
import uk.gegc.formbatch.features.billing.domain.exception.ReservationNotActiveException;
import uk.gegc.formbatch.features.billing.domain.model.CreditPool;
import uk.gegc.formbatch.features.billing.domain.model.CreditTransaction;
import uk.gegc.formbatch.features.billing.domain.model.CreditTransactionType;
import uk.gegc.formbatch.features.billing.domain.model.PoolSplit;
import uk.gegc.formbatch.features.billing.domain.model.Reservation;
import uk.gegc.formbatch.features.billing.domain.model.ReservationState;
import uk.gegc.formbatch.features.billing.infra.mapping.BalanceMapper;
import uk.gegc.formbatch.features.billing.infra.mapping.CreditTransactionMapper;
import uk.gegc.formbatch.features.billing.infra.mapping.ReservationMapper;
import uk.gegc.formbatch.features.billing.infra.repository.CreditTransactionRepository;
import uk.gegc.formbatch.features.billing.infra.repository.ReservationRepository;
import uk.gegc.formbatch.features.limits.domain.model.Tier;
import uk.gegc.formbatch.features.limits.domain.repository.TierRepository;
import uk.gegc.formbatch.shared.exception.ResourceNotFoundException;
import uk.gegc.formbatch.shared.security.AccessPolicy;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
public class CreditLedgerServiceImpl implements CreditLedgerService {

    private static final Logger log = LoggerFactory.getLogger(CreditLedgerServiceImpl.class);

    private final LedgerProperties ledgerProperties;
    private final AccountRepository accountRepository;
    private final ReservationRepository reservationRepository;
    private final CreditTransactionRepository transactionRepository;
    private final TierRepository tierRepository;

    private final BalanceMapper balanceMapper;
    private final ReservationMapper reservationMapper;
    private final CreditTransactionMapper transactionMapper;

    private final LedgerMetricsService metricsService;
    private final AccessPolicy accessPolicy;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public ReservationResult reserve(UUID accountId, long amount, UUID jobId) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be > 0");
        }
        String idempotencyKey = jobId != null ? "job:" + jobId + ":reserve" : null;
        return withRetry("reserve", () -> transactionTemplate.execute(status ->
                performReserve(accountId, amount, jobId, idempotencyKey)));
    }

    private ReservationResult performReserve(UUID accountId, long amount, UUID jobId, String idempotencyKey) {
        if (idempotencyKey != null) {
            var existing = transactionRepository.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                Reservation previous = reservationRepository.findById(existing.get().getReservationId())
                        .orElseThrow(() -> new IllegalStateException("Reservation referenced by " + idempotencyKey + " not found"));
                if (previous.getEstimatedCredits() != amount) {
                    throw new IllegalStateException("Job " + jobId + " already holds a reservation of "
                            + previous.getEstimatedCredits() + " credits");
                }
                log.info("reserve() replay for job {} returns reservation {}", jobId, previous.getId());
                return reservationMapper.toResult(previous);
            }
        }

        Account account = lockAccount(accountId);
        long available = account.totalCredits();
        if (available < amount) {
            metricsService.incrementInsufficientCredits();
            LedgerStructuredLogger.logRejection(log,
                    "Reservation rejected for account {}: required={} available={}",
                    accountId, "reserve", amount, accountId, amount, available);
            throw new InsufficientCreditsException(accountId, amount, available);
        }

        PoolSplit drawn = PoolSplit.draw(balancesOf(account), amount);
        applyDelta(account, negate(drawn));
        accountRepository.save(account);

        Reservation reservation = new Reservation();
        reservation.setAccountId(accountId);
        reservation.setState(ReservationState.ACTIVE);
        reservation.setEstimatedCredits(amount);
        reservation.setCommittedCredits(0L);
        reservation.setReserved(drawn);
        reservation.setJobId(jobId);
        reservation.setExpiresAt(LocalDateTime.now(clock).plusMinutes(ledgerProperties.getReservationTtlMinutes()));
        reservation = reservationRepository.save(reservation);

        journal(account, CreditTransactionType.RESERVE, amount, negate(drawn),
                reservation.getId(), idempotencyKey, null, null);
        metricsService.incrementReservationCreated(amount);

        LedgerStructuredLogger.logLedgerWrite(log,
                "Reserved {} credits for account {} (monthly={}, rollover={}, topup={})",
                accountId, CreditTransactionType.RESERVE.name(), amount, reservation.getId().toString(),
                account.getMonthlyCredits(), account.getRolloverCredits(), account.getTopupCredits(),
                amount, accountId, drawn.getMonthly(), drawn.getRollover(), drawn.getTopup());

        return reservationMapper.toResult(reservation);
    }

    @Override
    public CommitResult commit(UUID reservationId, long actualAmount) {
        if (actualAmount < 0) {
            throw new IllegalArgumentException("actualAmount must be >= 0");
        }
        return withRetry("commit", () -> transactionTemplate.execute(status ->
                performFinalize(reservationId, actualAmount, false)));
    }

    @Override
    public CommitResult release(UUID reservationId) {
        return withRetry("release", () -> transactionTemplate.execute(status ->
                performFinalize(reservationId, 0L, false)));
    }

    private CommitResult performFinalize(UUID reservationId, long actualAmount, boolean expiring) {
        Reservation reservation = reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation not found: " + reservationId));

        if (!reservation.isActive()) {
            return replayFinalize(reservation, actualAmount, expiring);
        }
        if (expiring && !reservation.getExpiresAt().isBefore(LocalDateTime.now(clock))) {
            return null;
        }
        if (actualAmount > reservation.getEstimatedCredits()) {
            throw new CommitExceedsReservedException("Commit of " + actualAmount + " exceeds reservation of "
                    + reservation.getEstimatedCredits() + " for " + reservationId);
        }

        Account account = lockAccount(reservation.getAccountId());

        long refundAmount = reservation.getEstimatedCredits() - actualAmount;
        PoolSplit refund = reservation.getReserved().refund(refundAmount);
        PoolSplit charged = reservation.getReserved().minus(refund);

        applyDelta(account, refund);
        account.setCreditsUsedTotal(account.getCreditsUsedTotal() + actualAmount);
        account.setCreditsUsedThisPeriod(account.getCreditsUsedThisPeriod() + actualAmount);
        if (actualAmount > 0) {
            account.setTotalRuns(account.getTotalRuns() + 1);
        }
        accountRepository.save(account);

        ReservationState finalState = expiring
                ? ReservationState.EXPIRED
                : actualAmount > 0 ? ReservationState.COMMITTED : ReservationState.RELEASED;
        reservation.setState(finalState);
        reservation.setCommittedCredits(actualAmount);
        reservation.setRefunded(refund);
        reservationRepository.save(reservation);

        CreditTransactionType txType = finalState == ReservationState.COMMITTED
                ? CreditTransactionType.COMMIT
                : CreditTransactionType.RELEASE;
        long txAmount = txType == CreditTransactionType.COMMIT ? actualAmount : refundAmount;
        journal(account, txType, txAmount, refund, reservationId,
                "reservation:" + reservationId + ":" + finalState.name().toLowerCase(),
                expiring ? "expired" : null, null);

        switch (finalState) {
            case COMMITTED -> metricsService.incrementReservationCommitted(actualAmount, refundAmount);
            case RELEASED -> metricsService.incrementReservationReleased(refundAmount);
            case EXPIRED -> {
                metricsService.incrementReservationExpired(refundAmount);
                publish(AuditEntry.builder()
                        .category(ActivityLogEntry.Category.CREDITS)
                        .activityType(ActivityLogEntry.ActivityType.RESERVATION_EXPIRED)
                        .actorType(ActivityLogEntry.ActorType.SYSTEM)
                        .targetAccountId(account.getId())
                        .action("reservation_expired")
                        .description("Reservation " + reservationId + " expired; " + refundAmount + " credits returned")
                        .relatedJobId(reservation.getJobId())
                        .build());
            }
            default -> {
            }
        }

        LedgerStructuredLogger.logLedgerWrite(log,
                "Finalized reservation {} as {}: charged={} refunded={}",
                account.getId(), txType.name(), txAmount, reservationId.toString(),
                account.getMonthlyCredits(), account.getRolloverCredits(), account.getTopupCredits(),
                reservationId, finalState, actualAmount, refundAmount);

        return toCommitResult(reservation, charged);
    }

    private CommitResult replayFinalize(Reservation reservation, long actualAmount, boolean expiring) {
        boolean sameCommit = reservation.getState() == ReservationState.COMMITTED
                && reservation.getCommittedCredits() == actualAmount;
        boolean sameRelease = reservation.getState() == ReservationState.RELEASED && actualAmount == 0;
        if (!expiring && (sameCommit || sameRelease)) {
            log.info("Reservation {} already {}; returning recorded result", reservation.getId(), reservation.getState());
            PoolSplit refunded = reservation.getRefunded() != null ? reservation.getRefunded() : PoolSplit.ZERO;
            return toCommitResult(reservation, reservation.getReserved().minus(refunded));
        }
        throw new ReservationNotActiveException("Reservation " + reservation.getId() + " is " + reservation.getState());
    }

    @Override
    public BalanceDto adjustCredits(UUID accountId, CreditPool pool, long delta, String reason, UUID actorId) {
        accessPolicy.requireAdmin(actorId);
        if (pool == null) {
            throw new IllegalArgumentException("pool is required");
        }
        if (delta == 0) {
            throw new IllegalArgumentException("delta must not be 0");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason is required for credit adjustments");
        }

        return withRetry("adjust", () -> transactionTemplate.execute(status -> {
            Account account = lockAccount(accountId);
            long before = balancesOf(account).get(pool);
            long after = before + delta;
            if (after < 0) {
                throw new IllegalArgumentException("Adjustment of " + delta + " would take " + pool
                        + " credits below zero (current " + before + ")");
            }

            PoolSplit change = single(pool, delta);
            applyDelta(account, change);
            account = accountRepository.saveAndFlush(account);

            journal(account, CreditTransactionType.ADJUSTMENT, Math.abs(delta), change, null, null, reason, actorId);
            metricsService.incrementCreditsAdjusted(pool, delta);

            Map<String, Object> changes = new LinkedHashMap<>();
            changes.put(pool.name().toLowerCase() + "Credits", Map.of("old", before, "new", after));
            publish(AuditEntry.builder()
                    .category(ActivityLogEntry.Category.CREDITS)
                    .activityType(ActivityLogEntry.ActivityType.CREDITS_ADJUSTED)
                    .actorType(ActivityLogEntry.ActorType.ADMIN)
                    .actorId(actorId)
                    .targetAccountId(accountId)
                    .action("admin_user_credits_updated")
                    .description("Adjusted " + pool.name().toLowerCase() + " credits by " + delta)
                    .reason(reason)
                    .changes(changes)
                    .relatedTierKey(account.getTierKey())
                    .build());

            LedgerStructuredLogger.logLedgerWrite(log,
                    "Adjusted {} credits for account {} by {} (actor {})",
                    accountId, CreditTransactionType.ADJUSTMENT.name(), delta, null,
                    account.getMonthlyCredits(), account.getRolloverCredits(), account.getTopupCredits(),
                    pool, accountId, delta, actorId);

            return balanceMapper.toDto(account);
        }));
    }

    @Override
    public boolean extendReservation(UUID reservationId) {
        return Boolean.TRUE.equals(withRetry("extend", () -> transactionTemplate.execute(status -> {
            Reservation reservation = reservationRepository.findById(reservationId)
                    .orElseThrow(() -> new ResourceNotFoundException("Reservation not found: " + reservationId));
            if (!reservation.isActive()) {
                return false;
            }
            long ttlMinutes = ledgerProperties.getReservationTtlMinutes();
            LocalDateTime now = LocalDateTime.now(clock);
            if (reservation.getExpiresAt().isAfter(now.plusSeconds(ttlMinutes * 30))) {
                return true;
            }
            reservation.setExpiresAt(now.plusMinutes(ttlMinutes));
            reservationRepository.save(reservation);
            log.debug("Reservation {} for job {} extended until {}",
                    reservationId, reservation.getJobId(), reservation.getExpiresAt());
            return true;
        })));
    }

    @Override
    @Transactional(readOnly = true)
    public BalanceDto getBalance(UUID accountId) {
        return accountRepository.findById(accountId)
                .map(balanceMapper::toDto)
                .orElseThrow(() -> new ResourceNotFoundException("Account not found: " + accountId));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<TransactionDto> listTransactions(UUID accountId, Pageable pageable) {
        return transactionRepository.findByAccountIdOrderByCreatedAtDesc(accountId, pageable)
                .map(transactionMapper::toDto);
    }

    @Override
    public int expireReservations() {
        LocalDateTime cutoff = LocalDateTime.now(clock);
        List<UUID> expiredIds = reservationRepository.findIdsByStateAndExpiresAtBefore(ReservationState.ACTIVE, cutoff);
        metricsService.recordSweeperBacklog(expiredIds.size());

        if (expiredIds.isEmpty()) {
            return 0;
        }
        log.info("Processing {} expired reservations", expiredIds.size());

        int expired = 0;
        for (UUID reservationId : expiredIds) {
            try {
                CommitResult result = withRetry("expire", () -> transactionTemplate.execute(status ->
                        performFinalize(reservationId, 0L, true)));
                if (result != null) {
                    expired++;
                } else {
                    log.debug("Reservation {} was extended before the sweeper reached it", reservationId);
                }
            } catch (ReservationNotActiveException e) {
                log.debug("Reservation {} finalized before the sweeper reached it", reservationId);
            } catch (RuntimeException e) {
                log.error("Failed to expire reservation {}", reservationId, e);
            }
        }
        return expired;
    }

    @Override
    public BalanceDto renewMonthlyAllowance(UUID accountId) {
        return withRetry("renew", () -> transactionTemplate.execute(status -> {
            Account account = lockAccount(accountId);
            Tier tier = tierRepository.findByTierKey(account.getTierKey())
                    .orElseThrow(() -> new ResourceNotFoundException("Tier not found: " + account.getTierKey()));

            long unusedMonthly = account.getMonthlyCredits();
            long allowance = tier.getMonthlyCredits();
            PoolSplit change = new PoolSplit(allowance - unusedMonthly, unusedMonthly, 0L);

            applyDelta(account, change);
            account.setCreditsUsedThisPeriod(0L);
            Account saved = accountRepository.saveAndFlush(account);

            journal(saved, CreditTransactionType.RENEWAL, allowance, change, null, null, "monthly renewal", null);

            Map<String, Object> changes = new LinkedHashMap<>();
            changes.put("monthlyCredits", Map.of("old", unusedMonthly, "new", saved.getMonthlyCredits()));
            changes.put("rolloverCredits", Map.of("old", saved.getRolloverCredits() - unusedMonthly, "new", saved.getRolloverCredits()));
            publish(AuditEntry.builder()
                    .category(ActivityLogEntry.Category.CREDITS)
                    .activityType(ActivityLogEntry.ActivityType.MONTHLY_ALLOWANCE_RENEWED)
                    .actorType(ActivityLogEntry.ActorType.SYSTEM)
                    .targetAccountId(accountId)
                    .action("monthly_allowance_renewed")
                    .description("Monthly allowance renewed to " + allowance + "; " + unusedMonthly + " credits rolled over")
                    .changes(changes)
                    .relatedTierKey(saved.getTierKey())
                    .build());

            LedgerStructuredLogger.logLedgerWrite(log,
                    "Renewed monthly allowance for account {}: allowance={} rolledOver={}",
                    accountId, CreditTransactionType.RENEWAL.name(), allowance, null,
                    saved.getMonthlyCredits(), saved.getRolloverCredits(), saved.getTopupCredits(),
                    accountId, allowance, unusedMonthly);

            return balanceMapper.toDto(saved);
        }));
    }

    private <T> T withRetry(String operation, Supplier<T> action) {
        int maxAttempts = ledgerProperties.getRetry().getMaxAttempts();
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return action.get();
            } catch (PessimisticLockingFailureException | OptimisticLockingFailureException ex) {
                if (attempts >= maxAttempts) {
                    log.warn("{}() lock contention persisted after {} attempts", operation, attempts);
                    throw ex;
                }
                metricsService.incrementLockRetry(operation);
                log.debug("{}() hit lock contention on attempt {}, retrying", operation, attempts);
                try {
                    Thread.sleep(ledgerProperties.getRetry().getBackoffMs() * attempts);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ex;
                }
            }
        }
    }

    private Account lockAccount(UUID accountId) {
        return accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account not found: " + accountId));
    }

    private static PoolSplit balancesOf(Account account) {
        return new PoolSplit(account.getMonthlyCredits(), account.getRolloverCredits(), account.getTopupCredits());
    }

    private static void applyDelta(Account account, PoolSplit delta) {
        long monthly = account.getMonthlyCredits() + delta.getMonthly();
        long rollover = account.getRolloverCredits() + delta.getRollover();
        long topup = account.getTopupCredits() + delta.getTopup();
        if (monthly < 0 || rollover < 0 || topup < 0) {
            throw new IllegalStateException("Ledger write would leave a negative pool on account " + account.getId());
        }
        account.setMonthlyCredits(monthly);
        account.setRolloverCredits(rollover);
        account.setTopupCredits(topup);
    }

    private static PoolSplit negate(PoolSplit split) {
        return new PoolSplit(-split.getMonthly(), -split.getRollover(), -split.getTopup());
    }

    private static PoolSplit single(CreditPool pool, long delta) {
        return switch (pool) {
            case MONTHLY -> new PoolSplit(delta, 0L, 0L);
            case ROLLOVER -> new PoolSplit(0L, delta, 0L);
            case TOPUP -> new PoolSplit(0L, 0L, delta);
        };
    }

    private void journal(Account account, CreditTransactionType type, long amount, PoolSplit delta,
                         UUID reservationId, String idempotencyKey, String reason, UUID actorId) {
        CreditTransaction tx = new CreditTransaction();
        tx.setAccountId(account.getId());
        tx.setType(type);
        tx.setAmount(amount);
        tx.setMonthlyDelta(delta.getMonthly());
        tx.setRolloverDelta(delta.getRollover());
        tx.setTopupDelta(delta.getTopup());
        tx.setReservationId(reservationId);
        tx.setIdempotencyKey(idempotencyKey);
        tx.setReason(reason);
        tx.setActorId(actorId);
        tx.setBalanceAfterMonthly(account.getMonthlyCredits());
        tx.setBalanceAfterRollover(account.getRolloverCredits());
        tx.setBalanceAfterTopup(account.getTopupCredits());
        tx.setCreatedAt(LocalDateTime.now(clock));
        transactionRepository.save(tx);
    }

    private CommitResult toCommitResult(Reservation reservation, PoolSplit charged) {
        return new CommitResult(
                reservation.getId(),
                reservation.getState(),
                reservation.getEstimatedCredits(),
                reservation.getCommittedCredits(),
                reservation.getEstimatedCredits() - reservation.getCommittedCredits(),
                charged.getMonthly(),
                charged.getRollover(),
                charged.getTopup()
        );
    }

    private void publish(AuditEntry entry) {
        eventPublisher.publishEvent(new ActivityRecordedEvent(this, entry));
    }
}
