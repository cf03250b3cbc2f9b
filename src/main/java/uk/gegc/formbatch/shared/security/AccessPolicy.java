package uk.gegc.formbatch.shared.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.formbatch.shared.exception.ForbiddenException;

import java.util.UUID;

/**
 * Capability checks applied at the service boundary of the ledger, limit
 * administration and job control operations.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessPolicy {

    private final ActorCapabilityResolver capabilityResolver;

    public boolean isOwner(UUID actorId, UUID ownerId) {
        return actorId != null && ownerId != null && ownerId.equals(actorId);
    }

    public boolean isAdmin(UUID actorId) {
        return capabilityResolver.isAdmin(actorId);
    }

    public void requireAdmin(UUID actorId) {
        if (!isAdmin(actorId)) {
            throwForbidden(actorId, "Admin capability required");
        }
    }

    public void requireOwnerOrAdmin(UUID actorId, UUID ownerId) {
        if (isOwner(actorId, ownerId) || isAdmin(actorId)) {
            return;
        }
        throwForbidden(actorId, "Owner or admin capability required");
    }

    private void throwForbidden(UUID actorId, String message) {
        log.warn("Access denied for actor {}: {}", actorId, message);
        throw new ForbiddenException(message);
    }
}
