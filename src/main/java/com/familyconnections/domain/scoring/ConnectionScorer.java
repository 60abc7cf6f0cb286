package com.familyconnections.domain.scoring;

import com.familyconnections.domain.exception.InvalidConfigurationException;
import com.familyconnections.domain.exception.MalformedRecordException;
import com.familyconnections.domain.model.ConfidenceTier;
import com.familyconnections.domain.model.ConnectionScoreResult;
import com.familyconnections.domain.model.DetectorResult;
import com.familyconnections.domain.model.NormalizedOfficer;
import com.familyconnections.domain.model.OfficerRecord;
import com.familyconnections.domain.model.SignalCategory;
import com.familyconnections.domain.normalize.OfficerRecordNormalizer;
import com.familyconnections.domain.signal.AddressSignalDetector;
import com.familyconnections.domain.signal.AgeSignalDetector;
import com.familyconnections.domain.signal.AppointmentSignalDetector;
import com.familyconnections.domain.signal.CompanyNameSignalDetector;
import com.familyconnections.domain.signal.NameSignalDetector;
import com.familyconnections.domain.signal.SignalDetector;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pairwise family-connection scorer.
 *
 * <p>Normalizes each record once, runs every detector in a fixed order (name,
 * age, appointment, address, company name), sums their weighted points and
 * maps the total to a {@link ConfidenceTier}. No detector is skipped because
 * of another's outcome, and no state survives a call, so one instance can be
 * shared by any number of threads.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * ConnectionScorer scorer = new ConnectionScorer(ScoringConfiguration.defaults());
 * ConnectionScoreResult result = scorer.score(recordA, recordB);
 * }</pre>
 *
 * @author Platform Team
 * @since 1.0.0
 */
@Slf4j
public class ConnectionScorer {

    @Getter
    private final ScoringConfiguration configuration;

    private final OfficerRecordNormalizer normalizer;

    @Getter
    private final List<SignalDetector> detectors;

    /**
     * Scorer with the standard normalizer and the five standard detectors.
     *
     * @throws InvalidConfigurationException if the configuration is invalid
     */
    public ConnectionScorer(ScoringConfiguration configuration) {
        this(Objects.requireNonNull(configuration, "configuration").validate(),
            new OfficerRecordNormalizer(), standardDetectors(configuration));
    }

    /**
     * @param detectors detectors in invocation order; at most one per category
     * @throws InvalidConfigurationException if the configuration is invalid or
     *         two detectors share a category
     */
    public ConnectionScorer(ScoringConfiguration configuration,
                            OfficerRecordNormalizer normalizer,
                            List<SignalDetector> detectors) {
        this.configuration = Objects.requireNonNull(configuration, "configuration").validate();
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");

        Set<SignalCategory> seen = EnumSet.noneOf(SignalCategory.class);
        for (SignalDetector detector : detectors) {
            if (!seen.add(detector.category())) {
                throw new InvalidConfigurationException("more than one detector registered for " + detector.category());
            }
        }
        this.detectors = List.copyOf(detectors);
    }

    /**
     * The five standard detectors, in invocation order.
     */
    public static List<SignalDetector> standardDetectors(ScoringConfiguration configuration) {
        return List.of(
            new NameSignalDetector(configuration),
            new AgeSignalDetector(configuration),
            new AppointmentSignalDetector(configuration),
            new AddressSignalDetector(configuration),
            new CompanyNameSignalDetector(configuration)
        );
    }

    /**
     * Score a pair of raw records.
     *
     * @throws MalformedRecordException if either record lacks a usable name
     */
    public ConnectionScoreResult score(OfficerRecord first, OfficerRecord second) {
        return score(normalize(first), normalize(second));
    }

    public NormalizedOfficer normalize(OfficerRecord record) {
        return normalizer.normalize(record);
    }

    /**
     * Score a pair of already-normalized records.
     */
    public ConnectionScoreResult score(NormalizedOfficer first, NormalizedOfficer second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");

        double total = 0.0;
        List<String> reasons = new ArrayList<>();
        Map<SignalCategory, DetectorResult> breakdown = new EnumMap<>(SignalCategory.class);

        for (SignalDetector detector : detectors) {
            DetectorResult result = detector.detect(first, second);
            breakdown.put(detector.category(), result);
            total += result.points();
            reasons.addAll(result.reasons());
        }

        if (configuration.getMaxScore() != null && total > configuration.getMaxScore()) {
            total = configuration.getMaxScore();
        }
        ConfidenceTier confidence = configuration.tierFor(total);

        if (log.isDebugEnabled()) {
            log.debug("Scored {} vs {}: total={}, confidence={}, reasons={}",
                first.label(), second.label(), total, confidence, reasons.size());
        }
        return new ConnectionScoreResult(total, reasons, confidence, breakdown);
    }
}
