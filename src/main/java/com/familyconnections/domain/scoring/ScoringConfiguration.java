package com.familyconnections.domain.scoring;

import com.familyconnections.domain.exception.InvalidConfigurationException;
import com.familyconnections.domain.model.ConfidenceTier;
import com.familyconnections.domain.model.SignalCategory;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Thresholds, points and weights shared by every detector.
 *
 * <p>Immutable value object, built once and passed by reference to each
 * detector, so a single instance can serve any number of concurrent scoring
 * calls. Points are awarded before the per-category weight multiplier is
 * applied.
 *
 * <p><strong>Invariants</strong> (checked by {@link #validate()}):
 * <ul>
 *   <li>surname similarity threshold within [0, 100]</li>
 *   <li>{@code 0 <= siblingAgeRange < generationalAgeGap}</li>
 *   <li>address proximity threshold strictly positive</li>
 *   <li>all points and weights finite and non-negative</li>
 *   <li>{@code 0 <= lowConfidenceCut < highConfidenceCut}</li>
 *   <li>maximum score, when set, strictly positive</li>
 * </ul>
 *
 * @author Platform Team
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class ScoringConfiguration {

    /**
     * How a surname match above threshold is converted into points.
     */
    public enum SurnameScoring {
        /** Full surname points whenever the ratio reaches the threshold. */
        FLAT,
        /**
         * Surname points scaled linearly with how far the ratio lies above the
         * threshold: half the points at the threshold, full points at 100,
         * i.e. {@code points * (0.5 + 0.5 * (ratio - threshold) / (100 - threshold))}.
         * A threshold of 100 always gives full points.
         */
        SCALED
    }

    // Name
    @Builder.Default
    double surnameSimilarityThreshold = 85.0;
    @Builder.Default
    SurnameScoring surnameScoring = SurnameScoring.FLAT;
    @Builder.Default
    double surnameMatchPoints = 2.0;
    @Builder.Default
    double middleNameMatchPoints = 3.0;

    // Age
    @Builder.Default
    double siblingAgeRange = 3.0;
    @Builder.Default
    double generationalAgeGap = 30.0;
    @Builder.Default
    double siblingPoints = 2.0;
    @Builder.Default
    double parentChildPoints = 3.0;

    // Appointments
    @Builder.Default
    double concurrentServicePoints = 3.0;
    @Builder.Default
    double historicalSharedCompanyPoints = 1.0;
    @Builder.Default
    double synchronizedTimingPoints = 2.0;
    @Builder.Default
    SynchronizationTolerance synchronizationTolerance = SynchronizationTolerance.sameMonth();

    // Address
    @Builder.Default
    double exactAddressPoints = 4.0;
    @Builder.Default
    double proximityPoints = 2.0;
    @Builder.Default
    double addressProximityThresholdMeters = 500.0;

    // Company name
    @Builder.Default
    double companyNamePoints = 2.0;

    // Per-category multipliers
    @Builder.Default
    double nameWeight = 1.0;
    @Builder.Default
    double ageWeight = 1.0;
    @Builder.Default
    double appointmentWeight = 1.0;
    @Builder.Default
    double addressWeight = 1.0;
    @Builder.Default
    double companyNameWeight = 1.0;

    // Confidence bands: score < low => LOW, score < high => MEDIUM, else HIGH
    @Builder.Default
    double lowConfidenceCut = 5.0;
    @Builder.Default
    double highConfidenceCut = 10.0;

    /**
     * Upper clamp for the total score; null disables clamping.
     */
    Double maxScore;

    public static ScoringConfiguration defaults() {
        return builder().build().validate();
    }

    public double weightFor(SignalCategory category) {
        switch (category) {
            case NAME:
                return nameWeight;
            case AGE:
                return ageWeight;
            case APPOINTMENT:
                return appointmentWeight;
            case ADDRESS:
                return addressWeight;
            case COMPANY_NAME:
                return companyNameWeight;
            default:
                throw new IllegalArgumentException("Unknown signal category: " + category);
        }
    }

    public ConfidenceTier tierFor(double score) {
        if (score < lowConfidenceCut) {
            return ConfidenceTier.LOW;
        }
        if (score < highConfidenceCut) {
            return ConfidenceTier.MEDIUM;
        }
        return ConfidenceTier.HIGH;
    }

    /**
     * Checks every invariant and reports all violations together.
     *
     * @return this configuration, for chaining
     * @throws InvalidConfigurationException if any invariant is broken
     */
    public ScoringConfiguration validate() {
        List<String> violations = new ArrayList<>();

        if (!Double.isFinite(surnameSimilarityThreshold)
                || surnameSimilarityThreshold < 0 || surnameSimilarityThreshold > 100) {
            violations.add("surnameSimilarityThreshold must be within [0, 100], got " + surnameSimilarityThreshold);
        }
        if (surnameScoring == null) {
            violations.add("surnameScoring must be set");
        }
        if (synchronizationTolerance == null) {
            violations.add("synchronizationTolerance must be set");
        }

        requireNonNegative(violations, "siblingAgeRange", siblingAgeRange);
        requireNonNegative(violations, "generationalAgeGap", generationalAgeGap);
        if (siblingAgeRange >= generationalAgeGap) {
            violations.add("siblingAgeRange (" + siblingAgeRange
                + ") must be below generationalAgeGap (" + generationalAgeGap + ")");
        }

        if (!Double.isFinite(addressProximityThresholdMeters) || addressProximityThresholdMeters <= 0) {
            violations.add("addressProximityThresholdMeters must be > 0, got " + addressProximityThresholdMeters);
        }

        requireNonNegative(violations, "surnameMatchPoints", surnameMatchPoints);
        requireNonNegative(violations, "middleNameMatchPoints", middleNameMatchPoints);
        requireNonNegative(violations, "siblingPoints", siblingPoints);
        requireNonNegative(violations, "parentChildPoints", parentChildPoints);
        requireNonNegative(violations, "concurrentServicePoints", concurrentServicePoints);
        requireNonNegative(violations, "historicalSharedCompanyPoints", historicalSharedCompanyPoints);
        requireNonNegative(violations, "synchronizedTimingPoints", synchronizedTimingPoints);
        requireNonNegative(violations, "exactAddressPoints", exactAddressPoints);
        requireNonNegative(violations, "proximityPoints", proximityPoints);
        requireNonNegative(violations, "companyNamePoints", companyNamePoints);

        for (SignalCategory category : SignalCategory.values()) {
            requireNonNegative(violations, "weight[" + category + "]", weightFor(category));
        }

        requireNonNegative(violations, "lowConfidenceCut", lowConfidenceCut);
        if (!(lowConfidenceCut < highConfidenceCut) || !Double.isFinite(highConfidenceCut)) {
            violations.add("confidence cuts must satisfy lowConfidenceCut < highConfidenceCut, got "
                + lowConfidenceCut + " / " + highConfidenceCut);
        }
        if (maxScore != null && (!Double.isFinite(maxScore) || maxScore <= 0)) {
            violations.add("maxScore must be > 0 when set, got " + maxScore);
        }

        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations);
        }
        return this;
    }

    private static void requireNonNegative(List<String> violations, String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            violations.add(name + " must be a finite value >= 0, got " + value);
        }
    }
}
