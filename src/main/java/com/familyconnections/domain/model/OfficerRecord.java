package com.familyconnections.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Raw corporate-officer record as handed over by an ingestion adapter.
 *
 * <p>Owned by the caller and never mutated during scoring. Dates are kept as
 * the strings the registry supplied; {@code OfficerRecordNormalizer} turns
 * them into comparable values.
 *
 * <p><strong>Required:</strong> {@code fullName}. Every other field may be
 * absent and only disables the signals that depend on it.
 *
 * @author Platform Team
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class OfficerRecord {

    /**
     * Optional upstream identifier, used to label batch results.
     */
    String officerId;

    /**
     * Display name, either {@code "William John Gregory"} or the registry
     * form {@code "GREGORY, William John"}.
     */
    String fullName;

    @Singular
    List<String> middleNames;

    /**
     * Derived from {@code fullName} when absent.
     */
    String surname;

    /**
     * Full date or year-month only (e.g. {@code 1958-03}).
     */
    String dateOfBirth;

    @Singular
    List<RoleRecord> roles;

    AddressRecord address;

    /**
     * Primary associated company, used by the company-name signal.
     */
    String companyName;
}
