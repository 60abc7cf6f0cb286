package com.familyconnections.config;

import com.familyconnections.domain.model.ConfidenceTier;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Group analysis settings bound from {@code family-connections.analysis.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "family-connections.analysis")
public class AnalysisProperties {

    /**
     * Worker threads scoring pairs; defaults to the number of processors.
     */
    @Min(1)
    private int workerThreads = Runtime.getRuntime().availableProcessors();

    @Min(1)
    private int queueCapacity = 1000;

    /**
     * Connections below this tier are left out of group results.
     */
    @NotNull
    private ConfidenceTier minimumConfidence = ConfidenceTier.LOW;
}
