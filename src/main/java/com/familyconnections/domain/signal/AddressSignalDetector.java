package com.familyconnections.domain.signal;

import com.familyconnections.domain.model.DetectorResult;
import com.familyconnections.domain.model.NormalizedOfficer;
import com.familyconnections.domain.model.SignalCategory;
import com.familyconnections.domain.scoring.ScoringConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;

/**
 * Exact address match, or failing that, geographic proximity.
 *
 * <p>Proximity is only tried when both officers carry coordinates; without
 * them the detector never guesses.
 */
@Slf4j
@RequiredArgsConstructor
public class AddressSignalDetector implements SignalDetector {

    private final ScoringConfiguration config;

    @Override
    public SignalCategory category() {
        return SignalCategory.ADDRESS;
    }

    @Override
    public DetectorResult detect(NormalizedOfficer first, NormalizedOfficer second) {
        double weight = config.weightFor(SignalCategory.ADDRESS);

        if (first.getAddressKey() != null && first.getAddressKey().equals(second.getAddressKey())) {
            log.debug("Exact address match between {} and {}", first.label(), second.label());
            return DetectorResult.of(config.getExactAddressPoints() * weight, List.of("Exact address match"));
        }

        if (!first.hasCoordinates() || !second.hasCoordinates()) {
            return DetectorResult.none();
        }

        double distance = GeoDistance.meters(
            first.getLatitude(), first.getLongitude(),
            second.getLatitude(), second.getLongitude());
        if (distance > config.getAddressProximityThresholdMeters()) {
            return DetectorResult.none();
        }

        log.debug("Addresses of {} and {} are {} m apart", first.label(), second.label(), distance);
        return DetectorResult.of(config.getProximityPoints() * weight, List.of(String.format(Locale.ROOT,
            "Nearby addresses (approx. %.0f m apart)", distance)));
    }
}
