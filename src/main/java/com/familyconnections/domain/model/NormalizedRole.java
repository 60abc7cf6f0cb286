package com.familyconnections.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Role with a canonical company number and parsed tenure.
 */
@Value
@Builder
public class NormalizedRole {

    String companyNumber;

    /**
     * Display only; may be null.
     */
    String companyName;

    String roleType;

    AppointmentDate appointment;

    /**
     * Null while the officer is still active.
     */
    LocalDate resignedOn;

    public boolean isActive() {
        return resignedOn == null;
    }

    public Optional<LocalDate> resignation() {
        return Optional.ofNullable(resignedOn);
    }

    public String describeCompany() {
        return companyName == null ? companyNumber : companyNumber + " (" + companyName + ")";
    }
}
