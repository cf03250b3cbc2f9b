package uk.gegc.formbatch.features.billing.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * An amount of credits broken down by pool.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class PoolSplit {

    public static final PoolSplit ZERO = new PoolSplit(0L, 0L, 0L);

    @Column(name = "monthly")
    private long monthly;

    @Column(name = "rollover")
    private long rollover;

    @Column(name = "topup")
    private long topup;

    public long total() {
        return monthly + rollover + topup;
    }

    public long get(CreditPool pool) {
        return switch (pool) {
            case MONTHLY -> monthly;
            case ROLLOVER -> rollover;
            case TOPUP -> topup;
        };
    }

    public PoolSplit minus(PoolSplit other) {
        return new PoolSplit(monthly - other.monthly, rollover - other.rollover, topup - other.topup);
    }

    /**
     * Splits {@code amount} across the given balances in draw order, taking from each pool
     * until the amount is covered.
     *
     * @throws IllegalArgumentException when the balances together cannot cover the amount
     */
    public static PoolSplit draw(PoolSplit available, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
        if (available.total() < amount) {
            throw new IllegalArgumentException("Balances " + available + " cannot cover " + amount);
        }
        long remaining = amount;
        long[] taken = new long[CreditPool.values().length];
        for (CreditPool pool : CreditPool.DRAW_ORDER) {
            long take = Math.min(remaining, available.get(pool));
            taken[pool.ordinal()] = take;
            remaining -= take;
            if (remaining == 0) {
                break;
            }
        }
        return new PoolSplit(taken[CreditPool.MONTHLY.ordinal()],
                taken[CreditPool.ROLLOVER.ordinal()],
                taken[CreditPool.TOPUP.ordinal()]);
    }

    /**
     * Portion of this drawn split to give back when {@code amount} credits are returned.
     * Pools are refunded in reverse draw order and never receive more than was drawn from them.
     */
    public PoolSplit refund(long amount) {
        if (amount < 0 || amount > total()) {
            throw new IllegalArgumentException("Refund " + amount + " outside drawn total " + total());
        }
        long remaining = amount;
        long[] returned = new long[CreditPool.values().length];
        for (CreditPool pool : CreditPool.REFUND_ORDER) {
            long give = Math.min(remaining, get(pool));
            returned[pool.ordinal()] = give;
            remaining -= give;
            if (remaining == 0) {
                break;
            }
        }
        return new PoolSplit(returned[CreditPool.MONTHLY.ordinal()],
                returned[CreditPool.ROLLOVER.ordinal()],
                returned[CreditPool.TOPUP.ordinal()]);
    }
}
