package uk.gegc.formbatch.features.batch.application;

import uk.gegc.formbatch.features.batch.domain.model.BatchStatus;
import uk.gegc.formbatch.features.batch.domain.model.FailureKind;
import uk.gegc.formbatch.features.batch.domain.model.RowOutcomeStatus;

public interface BatchMetricsService {

    void incrementJobSubmitted();
    void incrementJobFinished(BatchStatus status, FailureKind failureKind);
    void incrementRowOutcome(RowOutcomeStatus status);
    void incrementCancellationRequested();
}
