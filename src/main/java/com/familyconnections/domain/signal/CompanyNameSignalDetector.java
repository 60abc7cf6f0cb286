package com.familyconnections.domain.signal;

import com.familyconnections.domain.model.DetectorResult;
import com.familyconnections.domain.model.NormalizedOfficer;
import com.familyconnections.domain.model.SignalCategory;
import com.familyconnections.domain.scoring.ScoringConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Looks for one officer's surname or a middle name as a whole token in the
 * other officer's company name.
 *
 * <p>Checked in both directions; each matching direction scores on its own.
 * Trailing corporate suffixes are removed first so {@code "GREGORY LTD"} and
 * {@code "GREGORY LIMITED"} tokenize alike.
 */
@Slf4j
@RequiredArgsConstructor
public class CompanyNameSignalDetector implements SignalDetector {

    private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}]+");

    static final Set<String> CORPORATE_SUFFIXES = Set.of(
        "LIMITED", "LTD", "PLC", "LLP", "LP", "INC", "INCORPORATED",
        "CORPORATION", "CORP", "COMPANY", "CO", "CIC", "LLC", "GMBH"
    );

    private final ScoringConfiguration config;

    @Override
    public SignalCategory category() {
        return SignalCategory.COMPANY_NAME;
    }

    @Override
    public DetectorResult detect(NormalizedOfficer first, NormalizedOfficer second) {
        List<String> reasons = new ArrayList<>();
        double points = 0.0;

        Optional<String> forward = match(first, second);
        if (forward.isPresent()) {
            points += config.getCompanyNamePoints();
            reasons.add(forward.get());
        }
        Optional<String> backward = match(second, first);
        if (backward.isPresent()) {
            points += config.getCompanyNamePoints();
            reasons.add(backward.get());
        }

        double weighted = points * config.weightFor(SignalCategory.COMPANY_NAME);
        if (weighted > 0) {
            log.debug("Company name signal {} vs {}: {} points", first.label(), second.label(), weighted);
        }
        return DetectorResult.of(weighted, reasons);
    }

    /**
     * Does {@code owner}'s company name contain one of {@code other}'s names?
     */
    private static Optional<String> match(NormalizedOfficer owner, NormalizedOfficer other) {
        if (owner.getCompanyName() == null) {
            return Optional.empty();
        }
        List<String> companyTokens = companyTokens(owner.getCompanyName());
        if (companyTokens.isEmpty()) {
            return Optional.empty();
        }

        if (other.hasSurname()) {
            List<String> surnameTokens = tokenize(other.getSurname());
            if (!surnameTokens.isEmpty() && companyTokens.containsAll(surnameTokens)) {
                return Optional.of(reason(owner, other, "surname " + other.getSurnameDisplay()));
            }
        }
        for (int i = 0; i < other.getMiddleNames().size(); i++) {
            List<String> middleTokens = tokenize(other.getMiddleNames().get(i));
            if (!middleTokens.isEmpty() && companyTokens.containsAll(middleTokens)) {
                return Optional.of(reason(owner, other, "middle name " + other.getMiddleNamesDisplay().get(i)));
            }
        }
        return Optional.empty();
    }

    private static String reason(NormalizedOfficer owner, NormalizedOfficer other, String what) {
        return "Company name " + owner.getCompanyName() + " (" + owner.getDisplayName() + ") contains "
            + what + " of " + other.getDisplayName();
    }

    /**
     * Upper-case tokens with trailing corporate suffixes removed.
     */
    static List<String> companyTokens(String companyName) {
        List<String> tokens = tokenize(companyName);
        while (!tokens.isEmpty() && CORPORATE_SUFFIXES.contains(tokens.get(tokens.size() - 1))) {
            tokens.remove(tokens.size() - 1);
        }
        return tokens;
    }

    private static List<String> tokenize(String value) {
        return Arrays.stream(SEPARATORS.split(value.toUpperCase(Locale.ROOT)))
            .filter(token -> !token.isEmpty())
            .collect(Collectors.toCollection(ArrayList::new));
    }
}
