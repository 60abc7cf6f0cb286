package com.familyconnections.domain.exception;

import lombok.Getter;

/**
 * Raised when an officer record lacks its one required identity field.
 *
 * <p>Fatal for the pair being scored, never for a whole batch: group analysis
 * catches it per pair and carries on.
 */
@Getter
public class MalformedRecordException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Upstream id of the offending record, may be null.
     */
    private final String officerId;

    public MalformedRecordException(String message, String officerId) {
        super(officerId == null ? message : message + " (officer " + officerId + ")");
        this.officerId = officerId;
    }
}
