package uk.gegc.formbatch.shared.security;

import java.util.UUID;

/**
 * SPI answering capability questions about an actor. Identity lives outside this service,
 * so AccessPolicy depends on this interface rather than on a user store.
 */
public interface ActorCapabilityResolver {

    boolean isAdmin(UUID actorId);
}
