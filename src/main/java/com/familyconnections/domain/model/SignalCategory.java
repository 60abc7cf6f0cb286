package com.familyconnections.domain.model;

/**
 * Signal families, declared in detector invocation order.
 */
public enum SignalCategory {
    NAME,
    AGE,
    APPOINTMENT,
    ADDRESS,
    COMPANY_NAME
}
