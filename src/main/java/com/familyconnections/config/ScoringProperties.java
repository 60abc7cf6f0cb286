package com.familyconnections.config;

import com.familyconnections.domain.scoring.ScoringConfiguration;
import com.familyconnections.domain.scoring.SynchronizationTolerance;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized scoring settings bound from {@code family-connections.scoring.*}.
 *
 * <p>Every field is optional; unset fields keep the defaults of
 * {@link ScoringConfiguration}. Validation happens once, when the
 * {@code ConnectionScorer} bean is created.
 */
@Data
@ConfigurationProperties(prefix = "family-connections.scoring")
public class ScoringProperties {

    private Double surnameSimilarityThreshold;
    private ScoringConfiguration.SurnameScoring surnameScoring;
    private Double siblingAgeRange;
    private Double generationalAgeGap;

    /**
     * {@code same-month} or a day count such as {@code 14d}.
     */
    private String synchronizationTolerance;

    private Double addressProximityThresholdMeters;
    private Double maxScore;

    private Points points = new Points();
    private Weights weights = new Weights();
    private Confidence confidence = new Confidence();

    @Data
    public static class Points {
        private Double surnameMatch;
        private Double middleNameMatch;
        private Double sibling;
        private Double parentChild;
        private Double concurrentService;
        private Double historicalSharedCompany;
        private Double synchronizedTiming;
        private Double exactAddress;
        private Double proximity;
        private Double companyName;
    }

    @Data
    public static class Weights {
        private Double name;
        private Double age;
        private Double appointment;
        private Double address;
        private Double companyName;
    }

    @Data
    public static class Confidence {
        private Double lowCut;
        private Double highCut;
    }

    /**
     * Overlay the bound values on the defaults. The result is not validated yet.
     */
    public ScoringConfiguration toScoringConfiguration() {
        ScoringConfiguration.ScoringConfigurationBuilder b = ScoringConfiguration.builder();

        if (surnameSimilarityThreshold != null) b.surnameSimilarityThreshold(surnameSimilarityThreshold);
        if (surnameScoring != null) b.surnameScoring(surnameScoring);
        if (siblingAgeRange != null) b.siblingAgeRange(siblingAgeRange);
        if (generationalAgeGap != null) b.generationalAgeGap(generationalAgeGap);
        if (synchronizationTolerance != null) {
            b.synchronizationTolerance(SynchronizationTolerance.parse(synchronizationTolerance));
        }
        if (addressProximityThresholdMeters != null) b.addressProximityThresholdMeters(addressProximityThresholdMeters);
        b.maxScore(maxScore);

        if (points.surnameMatch != null) b.surnameMatchPoints(points.surnameMatch);
        if (points.middleNameMatch != null) b.middleNameMatchPoints(points.middleNameMatch);
        if (points.sibling != null) b.siblingPoints(points.sibling);
        if (points.parentChild != null) b.parentChildPoints(points.parentChild);
        if (points.concurrentService != null) b.concurrentServicePoints(points.concurrentService);
        if (points.historicalSharedCompany != null) b.historicalSharedCompanyPoints(points.historicalSharedCompany);
        if (points.synchronizedTiming != null) b.synchronizedTimingPoints(points.synchronizedTiming);
        if (points.exactAddress != null) b.exactAddressPoints(points.exactAddress);
        if (points.proximity != null) b.proximityPoints(points.proximity);
        if (points.companyName != null) b.companyNamePoints(points.companyName);

        if (weights.name != null) b.nameWeight(weights.name);
        if (weights.age != null) b.ageWeight(weights.age);
        if (weights.appointment != null) b.appointmentWeight(weights.appointment);
        if (weights.address != null) b.addressWeight(weights.address);
        if (weights.companyName != null) b.companyNameWeight(weights.companyName);

        if (confidence.lowCut != null) b.lowConfidenceCut(confidence.lowCut);
        if (confidence.highCut != null) b.highConfidenceCut(confidence.highCut);

        return b.build();
    }
}
