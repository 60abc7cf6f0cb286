package com.familyconnections.config;

import com.familyconnections.domain.normalize.OfficerRecordNormalizer;
import com.familyconnections.domain.scoring.ConnectionScorer;
import com.familyconnections.domain.scoring.ScoringConfiguration;
import com.familyconnections.domain.signal.AddressSignalDetector;
import com.familyconnections.domain.signal.AgeSignalDetector;
import com.familyconnections.domain.signal.AppointmentSignalDetector;
import com.familyconnections.domain.signal.CompanyNameSignalDetector;
import com.familyconnections.domain.signal.NameSignalDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the scoring engine from {@link ScoringProperties}.
 *
 * <p>Detectors are registered as beans so the timing aspect in
 * {@link PerformanceConfiguration} can observe them. An invalid configuration
 * fails context startup with an {@code InvalidConfigurationException}.
 */
@Configuration
@Slf4j
public class ScoringEngineConfiguration {

    @Bean
    public ScoringConfiguration scoringConfiguration(ScoringProperties properties) {
        ScoringConfiguration configuration = properties.toScoringConfiguration().validate();
        log.info("Scoring configuration: surnameThreshold={}, siblingRange={}, generationalGap={}, "
                + "tolerance={}, proximity={}m, confidenceCuts={}/{}, maxScore={}",
            configuration.getSurnameSimilarityThreshold(),
            configuration.getSiblingAgeRange(),
            configuration.getGenerationalAgeGap(),
            configuration.getSynchronizationTolerance(),
            configuration.getAddressProximityThresholdMeters(),
            configuration.getLowConfidenceCut(),
            configuration.getHighConfidenceCut(),
            configuration.getMaxScore());
        return configuration;
    }

    @Bean
    public OfficerRecordNormalizer officerRecordNormalizer() {
        return new OfficerRecordNormalizer();
    }

    @Bean
    public NameSignalDetector nameSignalDetector(ScoringConfiguration configuration) {
        return new NameSignalDetector(configuration);
    }

    @Bean
    public AgeSignalDetector ageSignalDetector(ScoringConfiguration configuration) {
        return new AgeSignalDetector(configuration);
    }

    @Bean
    public AppointmentSignalDetector appointmentSignalDetector(ScoringConfiguration configuration) {
        return new AppointmentSignalDetector(configuration);
    }

    @Bean
    public AddressSignalDetector addressSignalDetector(ScoringConfiguration configuration) {
        return new AddressSignalDetector(configuration);
    }

    @Bean
    public CompanyNameSignalDetector companyNameSignalDetector(ScoringConfiguration configuration) {
        return new CompanyNameSignalDetector(configuration);
    }

    /**
     * Scorer with detectors in the fixed invocation order.
     */
    @Bean
    public ConnectionScorer connectionScorer(ScoringConfiguration configuration,
                                             OfficerRecordNormalizer normalizer,
                                             NameSignalDetector name,
                                             AgeSignalDetector age,
                                             AppointmentSignalDetector appointment,
                                             AddressSignalDetector address,
                                             CompanyNameSignalDetector companyName) {
        return new ConnectionScorer(configuration, normalizer, List.of(name, age, appointment, address, companyName));
    }
}
