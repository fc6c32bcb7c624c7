package com.ainotes.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings of the tag backfill run.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "ainotes.backfill")
public class BackfillProperties {

    /**
     * Successfully processed notes between two commits.
     */
    @Min(1)
    private int checkpointInterval = 5;

    /**
     * Extra attempts per note after an enrichment failure.
     */
    @Min(0)
    private int maxRetries = 0;

    private Duration retryBackoff = Duration.ofMillis(500);
}
