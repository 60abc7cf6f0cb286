package com.familyconnections.application;

/**
 * Pair that could not be scored because one of its records is malformed.
 */
public record PairFailure(
    int firstIndex,
    int secondIndex,
    String message
) {}
