package com.familyconnections.domain.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised at configuration time when thresholds, points or weights are out of
 * range or not monotonic. Never raised while scoring.
 */
@Getter
public class InvalidConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public InvalidConfigurationException(List<String> violations) {
        super("Invalid scoring configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public InvalidConfigurationException(String violation) {
        this(List.of(violation));
    }
}
