package uk.gegc.formbatch.features.batch.application;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process view of cancellation requests so the dispatch loop can stop between rows
 * without a database round trip. The persisted {@code cancelRequested} flag stays the
 * source of truth.
 */
@Component
public class BatchCancellationRegistry {

    private final Set<UUID> cancelled = ConcurrentHashMap.newKeySet();

    public void requestCancel(UUID jobId) {
        cancelled.add(jobId);
    }

    public boolean isCancelRequested(UUID jobId) {
        return cancelled.contains(jobId);
    }

    public void clear(UUID jobId) {
        cancelled.remove(jobId);
    }
}
