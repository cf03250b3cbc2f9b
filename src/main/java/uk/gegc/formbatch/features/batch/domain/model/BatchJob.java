package uk.gegc.formbatch.features.batch.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;
import uk.gegc.formbatch.features.limits.domain.model.EffectiveLimits;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * One template + CSV submission. Carries the limits it was validated against, its credit
 * reservation and the per-row outcomes. No field changes once the status is terminal.
 *
 * <p>Updates write only dirty columns so the processing thread never overwrites a
 * concurrently set cancellation flag.
 */
@Entity
@Table(name = "batch_jobs",
        uniqueConstraints = @UniqueConstraint(name = "uk_batch_jobs_account_idempotency",
                columnNames = {"account_id", "idempotency_key"}),
        indexes = @Index(name = "idx_batch_jobs_account_created", columnList = "account_id, created_at"))
@DynamicUpdate
@Getter
@Setter
@NoArgsConstructor
public class BatchJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "template_ref", nullable = false)
    private String templateRef;

    @Column(name = "data_ref", nullable = false)
    private String dataRef;

    @Column(name = "template_file_name")
    private String templateFileName;

    @Column(name = "idempotency_key", length = 255)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private BatchStatus status = BatchStatus.SUBMITTED;

    @Embedded
    private EffectiveLimits limits;

    @Column(name = "total_rows", nullable = false)
    private int totalRows;

    @Column(name = "processed_rows", nullable = false)
    private int processedRows;

    @Column(name = "succeeded_rows", nullable = false)
    private int succeededRows;

    @Column(name = "failed_rows", nullable = false)
    private int failedRows;

    @Column(name = "skipped_rows", nullable = false)
    private int skippedRows;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "batch_row_outcomes", joinColumns = @JoinColumn(name = "job_id"))
    @OrderBy("rowIndex ASC")
    private Set<RowOutcome> rowOutcomes = new LinkedHashSet<>();

    @Column(name = "estimated_credits", nullable = false)
    private long estimatedCredits;

    @Column(name = "monthly_used", nullable = false)
    private long monthlyUsed;

    @Column(name = "rollover_used", nullable = false)
    private long rolloverUsed;

    @Column(name = "topup_used", nullable = false)
    private long topupUsed;

    @Column(name = "total_used", nullable = false)
    private long totalUsed;

    @Column(name = "reservation_id")
    private UUID reservationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "ledger_state", nullable = false, length = 16)
    private LedgerState ledgerState = LedgerState.NONE;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested;

    @Column(name = "output_ref")
    private String outputRef;

    @Column(name = "output_file_name")
    private String outputFileName;

    @Column(name = "output_size_bytes")
    private Long outputSizeBytes;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind", length = 32)
    private FailureKind failureKind;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "reconciliation_note", length = 2000)
    private String reconciliationNote;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
        if (status == null) {
            status = BatchStatus.SUBMITTED;
        }
        if (ledgerState == null) {
            ledgerState = LedgerState.NONE;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * Moves to a non-terminal status.
     *
     * @throws IllegalStateException when the job already finished
     */
    public void advanceTo(BatchStatus next) {
        requireNotTerminal();
        this.status = next;
    }

    /**
     * Records one finished row and bumps the matching counter.
     */
    public void recordOutcome(RowOutcome outcome) {
        requireNotTerminal();
        rowOutcomes.add(outcome);
        processedRows++;
        switch (outcome.getStatus()) {
            case SUCCEEDED -> succeededRows++;
            case FAILED -> failedRows++;
            case SKIPPED -> skippedRows++;
        }
    }

    public void markFailed(FailureKind kind, String message, LocalDateTime at) {
        requireNotTerminal();
        this.status = BatchStatus.FAILED;
        this.failureKind = kind;
        this.errorMessage = message;
        this.completedAt = at;
    }

    public void markFinished(BatchStatus terminal, LocalDateTime at) {
        requireNotTerminal();
        if (!terminal.isTerminal() || terminal == BatchStatus.FAILED) {
            throw new IllegalArgumentException("Use markFailed for " + terminal);
        }
        this.status = terminal;
        this.completedAt = at;
    }

    public double getProgressPercentage() {
        if (totalRows <= 0) {
            return isTerminal() ? 100.0 : 0.0;
        }
        return (double) processedRows / totalRows * 100.0;
    }

    public Long getDurationSeconds() {
        if (startedAt == null) {
            return 0L;
        }
        LocalDateTime end = completedAt != null ? completedAt : LocalDateTime.now();
        return Duration.between(startedAt, end).getSeconds();
    }

    private void requireNotTerminal() {
        if (isTerminal()) {
            throw new IllegalStateException("Job " + id + " is already " + status);
        }
    }
}
