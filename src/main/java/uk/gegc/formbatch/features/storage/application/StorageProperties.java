package uk.gegc.formbatch.features.storage.application;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "formbatch.storage")
@Validated
@Data
public class StorageProperties {

    /**
     * Directory that holds every stored blob.
     */
    @NotBlank
    private String rootDir = "data/files";
}
