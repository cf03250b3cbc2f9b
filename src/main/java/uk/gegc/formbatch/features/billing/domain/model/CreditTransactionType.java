package uk.gegc.formbatch.features.billing.domain.model;

public enum CreditTransactionType {
    RESERVE,
    COMMIT,
    RELEASE,
    ADJUSTMENT,
    RENEWAL
}
