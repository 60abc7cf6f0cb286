package com.familyconnections.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One appointment of an officer at a company.
 *
 * <p>{@code appointedBefore} is only an upper bound on an unknown appointment
 * date and is never treated as {@code appointedOn}. A missing
 * {@code resignedOn} means the officer is presumed still active.
 */
@Value
@Builder(toBuilder = true)
public class RoleRecord {
    String companyNumber;
    String companyName;
    String roleType;
    String appointedOn;
    String appointedBefore;
    String resignedOn;
}
