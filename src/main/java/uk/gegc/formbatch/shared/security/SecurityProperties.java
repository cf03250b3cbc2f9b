package uk.gegc.formbatch.shared.security;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "formbatch.security")
public class SecurityProperties {

    /**
     * Actors allowed to adjust credits and override limits.
     */
    private Set<UUID> adminActorIds = new LinkedHashSet<>();
}
