package com.familyconnections.domain.signal;

import com.familyconnections.domain.model.DetectorResult;
import com.familyconnections.domain.model.NormalizedOfficer;
import com.familyconnections.domain.model.SignalCategory;
import com.familyconnections.domain.scoring.ScoringConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fuzzy surname match plus exact (case-insensitive) shared middle names.
 *
 * <p>Each shared middle name earns its own points and reason. Display forms
 * in reasons are picked independently of argument order so the reason set is
 * symmetric.
 */
@Slf4j
@RequiredArgsConstructor
public class NameSignalDetector implements SignalDetector {

    private final ScoringConfiguration config;

    @Override
    public SignalCategory category() {
        return SignalCategory.NAME;
    }

    @Override
    public DetectorResult detect(NormalizedOfficer first, NormalizedOfficer second) {
        double points = 0.0;
        List<String> reasons = new ArrayList<>();

        if (first.hasSurname() && second.hasSurname()) {
            double ratio = NameSimilarity.tokenSortRatio(first.getSurname(), second.getSurname());
            if (ratio >= config.getSurnameSimilarityThreshold()) {
                points += surnamePoints(ratio);
                reasons.add(String.format(Locale.ROOT, "Surname match: %s (%.0f%% similar)",
                    orderedPair(first.getSurnameDisplay(), second.getSurnameDisplay()), ratio));
            }
        }

        for (String shared : sharedMiddleNames(first, second)) {
            points += config.getMiddleNameMatchPoints();
            reasons.add("Shared middle name: " + shared);
        }

        double weighted = points * config.weightFor(SignalCategory.NAME);
        if (weighted > 0) {
            log.debug("Name signal {} vs {}: {} points", first.label(), second.label(), weighted);
        }
        return DetectorResult.of(weighted, reasons);
    }

    private double surnamePoints(double ratio) {
        if (config.getSurnameScoring() == ScoringConfiguration.SurnameScoring.SCALED) {
            double threshold = config.getSurnameSimilarityThreshold();
            double aboveThreshold = threshold >= 100.0 ? 1.0 : (ratio - threshold) / (100.0 - threshold);
            return config.getSurnameMatchPoints() * (0.5 + 0.5 * aboveThreshold);
        }
        return config.getSurnameMatchPoints();
    }

    /**
     * Shared middle names in the first officer's order, shown in whichever
     * casing sorts first.
     */
    private static Collection<String> sharedMiddleNames(NormalizedOfficer first, NormalizedOfficer second) {
        Map<String, String> shared = new LinkedHashMap<>();
        List<String> firstKeys = first.getMiddleNames();
        List<String> secondKeys = second.getMiddleNames();
        for (int i = 0; i < firstKeys.size(); i++) {
            String key = firstKeys.get(i);
            int j = secondKeys.indexOf(key);
            if (j >= 0 && !shared.containsKey(key)) {
                shared.put(key, lesser(first.getMiddleNamesDisplay().get(firstKeys.indexOf(key)),
                    second.getMiddleNamesDisplay().get(j)));
            }
        }
        return shared.values();
    }

    private static String orderedPair(String a, String b) {
        if (a.equals(b)) {
            return a;
        }
        return a.compareTo(b) <= 0 ? a + " / " + b : b + " / " + a;
    }

    private static String lesser(String a, String b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
