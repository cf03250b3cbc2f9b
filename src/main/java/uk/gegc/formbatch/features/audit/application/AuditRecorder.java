package uk.gegc.formbatch.features.audit.application;

import uk.gegc.formbatch.features.audit.api.dto.AuditEntry;

/**
 * Appends activity log entries. Implementations must never throw: a failed write is
 * reported on the fallback log channel and the calling operation carries on.
 */
public interface AuditRecorder {

    void record(AuditEntry entry);
}
