package uk.gegc.formbatch.features.batch.domain.events;

import org.springframework.context.ApplicationEvent;
import uk.gegc.formbatch.features.batch.domain.model.RowOutcomeStatus;

import java.util.UUID;

/**
 * One row of a job finished (or was skipped) and its outcome is stored.
 */
public class BatchRowCompletedEvent extends ApplicationEvent {

    private final UUID jobId;
    private final int rowIndex;
    private final RowOutcomeStatus status;
    private final int processedRows;
    private final int totalRows;

    public BatchRowCompletedEvent(Object source, UUID jobId, int rowIndex, RowOutcomeStatus status,
                                  int processedRows, int totalRows) {
        super(source);
        this.jobId = jobId;
        this.rowIndex = rowIndex;
        this.status = status;
        this.processedRows = processedRows;
        this.totalRows = totalRows;
    }

    public UUID getJobId() {
        return jobId;
    }

    public int getRowIndex() {
        return rowIndex;
    }

    public RowOutcomeStatus getStatus() {
        return status;
    }

    public int getProcessedRows() {
        return processedRows;
    }

    public int getTotalRows() {
        return totalRows;
    }
}
