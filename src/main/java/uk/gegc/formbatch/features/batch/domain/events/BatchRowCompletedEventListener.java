package uk.gegc.formbatch.features.batch.domain.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import uk.gegc.formbatch.features.batch.application.BatchMetricsService;

@Component
@RequiredArgsConstructor
@Slf4j
public class BatchRowCompletedEventListener {

    private final BatchMetricsService metricsService;

    @EventListener
    public void onRowCompleted(BatchRowCompletedEvent event) {
        metricsService.incrementRowOutcome(event.getStatus());
        log.debug("Job {} row {} {} ({}/{})", event.getJobId(), event.getRowIndex() + 1,
                event.getStatus(), event.getProcessedRows(), event.getTotalRows());
    }
}
