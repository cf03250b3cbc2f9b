package uk.gegc.formbatch.features.batch.domain.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.formbatch.features.batch.application.BatchProcessor;

/**
 * Starts processing a submitted job on the batch pool once the submit transaction commits.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchJobSubmittedEventListener {

    private final BatchProcessor batchProcessor;

    @Async("batchTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleBatchJobSubmitted(BatchJobSubmittedEvent event) {
        log.debug("Received BatchJobSubmittedEvent for job {}", event.getJobId());
        batchProcessor.process(event.getJobId());
    }
}
