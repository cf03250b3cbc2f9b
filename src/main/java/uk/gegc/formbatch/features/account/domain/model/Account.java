package uk.gegc.formbatch.features.account.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.formbatch.features.limits.domain.model.CustomLimits;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Ledger row for one customer: the three credit pools, usage counters and the limit
 * configuration (tier plus optional override).
 */
@Entity
@Table(name = "accounts")
@Getter
@Setter
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tier_key", nullable = false, length = 50)
    private String tierKey;

    @Column(name = "monthly_credits", nullable = false)
    private long monthlyCredits;

    @Column(name = "rollover_credits", nullable = false)
    private long rolloverCredits;

    @Column(name = "topup_credits", nullable = false)
    private long topupCredits;

    @Column(name = "credits_used_total", nullable = false)
    private long creditsUsedTotal;

    @Column(name = "credits_used_this_period", nullable = false)
    private long creditsUsedThisPeriod;

    @Column(name = "total_runs", nullable = false)
    private long totalRuns;

    @Embedded
    private CustomLimits customLimits;

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

    public long totalCredits() {
        return monthlyCredits + rolloverCredits + topupCredits;
    }

    public boolean hasCustomLimits() {
        return customLimits != null && customLimits.getReason() != null;
    }
}
