package uk.gegc.formbatch.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Credits held for one job between submission and final charge. {@code reserved} records
 * exactly which pools the credits came from so a refund can return them to the same pools.
 */
@Entity
@Table(name = "reservations", indexes = {
        @Index(name = "idx_reservations_state_expires", columnList = "state, expires_at"),
        @Index(name = "idx_reservations_account", columnList = "account_id")
})
@Getter
@Setter
public class Reservation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 32)
    private ReservationState state;

    @Column(name = "estimated_credits", nullable = false)
    private long estimatedCredits;

    @Column(name = "committed_credits", nullable = false)
    private long committedCredits;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "monthly", column = @Column(name = "reserved_monthly", nullable = false)),
            @AttributeOverride(name = "rollover", column = @Column(name = "reserved_rollover", nullable = false)),
            @AttributeOverride(name = "topup", column = @Column(name = "reserved_topup", nullable = false))
    })
    private PoolSplit reserved;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "monthly", column = @Column(name = "refunded_monthly")),
            @AttributeOverride(name = "rollover", column = @Column(name = "refunded_rollover")),
            @AttributeOverride(name = "topup", column = @Column(name = "refunded_topup"))
    })
    private PoolSplit refunded;

    @Column(name = "job_id")
    private UUID jobId;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    void prePersist() {
        LocalDateTime now = LocalDateTime.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isActive() {
        return state == ReservationState.ACTIVE;
    }
}
