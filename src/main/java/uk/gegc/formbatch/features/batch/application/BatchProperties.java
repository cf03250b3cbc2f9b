package uk.gegc.formbatch.features.batch.application;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Batch processing configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "formbatch.batch")
@Validated
@Data
public class BatchProperties {

    /**
     * Credits charged for each successfully generated row.
     */
    @Positive
    private long creditsPerRow = 1L;

    /**
     * Upper bound on the form-fill call for a single row.
     */
    @Positive
    private long rowTimeoutMs = 30_000L;

    /**
     * Rows of one job in flight at the same time.
     */
    @Min(1)
    private int maxParallelRows = 4;

    /**
     * Non-terminal jobs untouched for this long are failed by the cleanup scheduler.
     */
    @Positive
    private long staleJobTimeoutMinutes = 120L;
}
