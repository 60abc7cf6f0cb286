package com.familyconnections.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Canonical form of an {@link OfficerRecord}, produced once per record and
 * shared by every detector.
 *
 * <p>Comparison keys ({@code surname}, {@code middleNames},
 * {@code addressKey}) are upper-cased and whitespace-collapsed. The
 * {@code *Display} counterparts keep the caller's casing for reasons.
 *
 * @author Platform Team
 * @since 1.0.0
 */
@Value
@Builder
public class NormalizedOfficer {

    String officerId;

    String displayName;

    /**
     * Upper-cased surname, empty when none could be derived.
     */
    String surname;

    String surnameDisplay;

    @Singular
    List<String> middleNames;

    /**
     * Same order as {@link #middleNames}.
     */
    @Singular("middleNameDisplay")
    List<String> middleNamesDisplay;

    PartialDate dateOfBirth;

    @Singular
    List<NormalizedRole> roles;

    /**
     * Whitespace-collapsed upper-case address, or null.
     */
    String addressKey;

    Double latitude;

    Double longitude;

    String companyName;

    public Optional<PartialDate> birthDate() {
        return Optional.ofNullable(dateOfBirth);
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    public boolean hasSurname() {
        return surname != null && !surname.isEmpty();
    }

    /**
     * Label for logs and batch results: the upstream id when present,
     * otherwise the display name.
     */
    public String label() {
        return officerId != null ? officerId : displayName;
    }
}
