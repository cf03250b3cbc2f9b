package uk.gegc.formbatch.features.audit.domain.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.formbatch.features.audit.application.AuditRecorder;

@Component
@RequiredArgsConstructor
@Slf4j
public class ActivityRecordedEventListener {

    private final AuditRecorder auditRecorder;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onActivityRecorded(ActivityRecordedEvent event) {
        log.debug("Recording {} after commit", event.getEntry().activityType());
        auditRecorder.record(event.getEntry());
    }
}
