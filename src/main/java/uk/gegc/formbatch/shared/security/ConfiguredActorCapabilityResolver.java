package uk.gegc.formbatch.shared.security;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Default resolver backed by {@code formbatch.security.admin-actor-ids}.
 * An identity provider integration can supply its own {@link ActorCapabilityResolver}
 * bean marked {@code @Primary} to replace it.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredActorCapabilityResolver implements ActorCapabilityResolver {

    private final SecurityProperties securityProperties;

    @Override
    public boolean isAdmin(UUID actorId) {
        return actorId != null && securityProperties.getAdminActorIds().contains(actorId);
    }
}
