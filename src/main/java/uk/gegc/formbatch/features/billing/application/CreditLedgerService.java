package uk.gegc.formbatch.features.billing.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.formbatch.features.billing.api.dto.BalanceDto;
import uk.gegc.formbatch.features.billing.api.dto.CommitResult;
import uk.gegc.formbatch.features.billing.api.dto.ReservationResult;
import uk.gegc.formbatch.features.billing.api.dto.TransactionDto;
import uk.gegc.formbatch.features.billing.domain.model.CreditPool;

import java.util.UUID;

/**
 * Per-account credit ledger over the monthly, rollover and top-up pools.
 *
 * <p>Credits are drawn monthly first, then rollover, then top-up. Every balance change
 * happens under a row lock on the account and is journaled as a credit transaction.
 */
public interface CreditLedgerService {

    /**
     * Holds {@code amount} credits for a job.
     *
     * @param jobId optional; when given, a repeated call for the same job returns the
     *              existing reservation instead of holding credits twice
     * @throws uk.gegc.formbatch.features.billing.domain.exception.InsufficientCreditsException
     *         when the pools together hold less than {@code amount}; nothing is debited
     */
    ReservationResult reserve(UUID accountId, long amount, UUID jobId);

    /**
     * Finalizes a reservation at {@code actualAmount} (0..estimated). The unused part is
     * returned to the pools it came from, top-up first.
     */
    CommitResult commit(UUID reservationId, long actualAmount);

    /**
     * Returns the whole reservation. Same as {@code commit(reservationId, 0)}.
     */
    CommitResult release(UUID reservationId);

    /**
     * Direct administrative change to one pool. {@code delta} may be negative but can never
     * take the pool below zero.
     */
    BalanceDto adjustCredits(UUID accountId, CreditPool pool, long delta, String reason, UUID actorId);

    /**
     * Moves the expiry of an ACTIVE reservation to a full TTL from now, so a job that is
     * still producing rows keeps its hold. Nothing is written while more than half the TTL
     * remains.
     *
     * @return false when the reservation is no longer ACTIVE
     */
    boolean extendReservation(UUID reservationId);

    BalanceDto getBalance(UUID accountId);

    Page<TransactionDto> listTransactions(UUID accountId, Pageable pageable);

    /**
     * Releases ACTIVE reservations whose TTL has passed. A reservation extended after the
     * sweep selected it is left alone.
     *
     * @return number of reservations expired by this run
     */
    int expireReservations();

    /**
     * Starts a new allowance period: unused monthly credits move to rollover and the
     * monthly pool is refilled from the account's tier.
     */
    BalanceDto renewMonthlyAllowance(UUID accountId);
}
