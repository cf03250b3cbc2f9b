package uk.gegc.formbatch.features.billing.domain.model;

import java.util.List;

/**
 * The three balances an account spends from. Declaration order is the draw order:
 * allowances that expire go first, purchased top-up credits last.
 */
public enum CreditPool {
    MONTHLY,
    ROLLOVER,
    TOPUP;

    public static final List<CreditPool> DRAW_ORDER = List.of(MONTHLY, ROLLOVER, TOPUP);

    public static final List<CreditPool> REFUND_ORDER = List.of(TOPUP, ROLLOVER, MONTHLY);
}
