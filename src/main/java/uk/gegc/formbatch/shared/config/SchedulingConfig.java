package uk.gegc.formbatch.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the reservation sweeper. Switched off in tests so expiry runs only when invoked.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "formbatch.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
