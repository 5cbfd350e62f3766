package com.ironcondor.domain.enums;

/**
 * Severity of a monitoring alert.
 */
public enum AlertSeverity {

    /** Requires trader attention. */
    WARNING,

    /** Informational, no action required. */
    INFO
}
