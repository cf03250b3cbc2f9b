package uk.gegc.formbatch.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Ledger journal row. Deltas are signed changes to the account's pool balances made by
 * this write; balance columns are snapshots after it.
 */
@Entity
@Table(name = "credit_transactions", indexes = {
        @Index(name = "idx_credit_tx_account_created", columnList = "account_id, created_at"),
        @Index(name = "idx_credit_tx_reservation", columnList = "reservation_id")
})
@Getter
@Setter
public class CreditTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32)
    private CreditTransactionType type;

    @Column(name = "amount", nullable = false)
    private long amount;

    @Column(name = "monthly_delta", nullable = false)
    private long monthlyDelta;

    @Column(name = "rollover_delta", nullable = false)
    private long rolloverDelta;

    @Column(name = "topup_delta", nullable = false)
    private long topupDelta;

    @Column(name = "reservation_id")
    private UUID reservationId;

    @Column(name = "idempotency_key", length = 255, unique = true)
    private String idempotencyKey;

    @Column(name = "reason", length = 500)
    private String reason;

    @Column(name = "actor_id")
    private UUID actorId;

    @Column(name = "balance_after_monthly", nullable = false)
    private long balanceAfterMonthly;

    @Column(name = "balance_after_rollover", nullable = false)
    private long balanceAfterRollover;

    @Column(name = "balance_after_topup", nullable = false)
    private long balanceAfterTopup;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
