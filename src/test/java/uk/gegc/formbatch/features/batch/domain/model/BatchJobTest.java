package uk.gegc.formbatch.features.batch.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BatchJob")
class BatchJobTest {

    @Test
    @DisplayName("recording outcomes updates the matching counters and progress")
    void countersFollowOutcomes() {
        BatchJob job = new BatchJob();
        job.setTotalRows(4);

        job.recordOutcome(RowOutcome.succeeded(0, "a.pdf", "ref-a"));
        job.recordOutcome(RowOutcome.failed(1, "b.pdf", "bad"));
        job.recordOutcome(RowOutcome.skipped(2));

        assertThat(job.getProcessedRows()).isEqualTo(3);
        assertThat(job.getSucceededRows()).isEqualTo(1);
        assertThat(job.getFailedRows()).isEqualTo(1);
        assertThat(job.getSkippedRows()).isEqualTo(1);
        assertThat(job.getProgressPercentage()).isEqualTo(75.0);
    }

    @Test
    @DisplayName("outcomes iterate in row order")
    void outcomesInRowOrder() {
        BatchJob job = new BatchJob();
        job.recordOutcome(RowOutcome.succeeded(0, "a.pdf", "r0"));
        job.recordOutcome(RowOutcome.succeeded(1, "b.pdf", "r1"));

        assertThat(job.getRowOutcomes()).extracting(RowOutcome::getRowIndex).containsExactly(0, 1);
    }

    @Test
    @DisplayName("nothing changes once the job is terminal")
    void terminalIsFrozen() {
        BatchJob job = new BatchJob();
        job.markFailed(FailureKind.VALIDATION, "Data file contains no data rows", LocalDateTime.now());

        assertThat(job.isTerminal()).isTrue();
        assertThat(job.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThatThrownBy(() -> job.advanceTo(BatchStatus.PROCESSING)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> job.recordOutcome(RowOutcome.skipped(0))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> job.markFinished(BatchStatus.COMPLETED, LocalDateTime.now()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("markFinished only accepts successful terminal states")
    void markFinishedGuardsStatus() {
        BatchJob job = new BatchJob();

        assertThatThrownBy(() -> job.markFinished(BatchStatus.FAILED, LocalDateTime.now()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> job.markFinished(BatchStatus.PROCESSING, LocalDateTime.now()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("failed row messages are capped to the column size")
    void longErrorTruncated() {
        RowOutcome outcome = RowOutcome.failed(0, "a.pdf", "e".repeat(5000));

        assertThat(outcome.getErrorMessage()).hasSize(1000);
    }
}
