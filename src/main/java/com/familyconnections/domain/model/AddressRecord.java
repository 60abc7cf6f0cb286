package com.familyconnections.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Service or correspondence address, optionally geocoded by the caller.
 */
@Value
@Builder(toBuilder = true)
public class AddressRecord {
    String fullAddress;
    Double latitude;
    Double longitude;

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
