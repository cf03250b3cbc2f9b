package uk.gegc.formbatch.features.audit.domain.events;

import org.springframework.context.ApplicationEvent;
import uk.gegc.formbatch.features.audit.api.dto.AuditEntry;

/**
 * Published by business services inside their transaction. The entry is written once the
 * publishing transaction commits, so a rolled back operation leaves no activity record.
 */
public class ActivityRecordedEvent extends ApplicationEvent {

    private final AuditEntry entry;

    public ActivityRecordedEvent(Object source, AuditEntry entry) {
        super(source);
        this.entry = entry;
    }

    public AuditEntry getEntry() {
        return entry;
    }
}
