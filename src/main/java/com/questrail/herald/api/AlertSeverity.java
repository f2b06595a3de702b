package com.questrail.herald.api;

/**
 * How urgently a sink should surface an alert.
 */
public enum AlertSeverity {
    /** Routine scheduled notice (allowance credited, bin reminder). */
    INFO,
    /** End of a tracked activity (train departed). */
    NOTICE,
    /** A tracked value changed unexpectedly (platform, delay, cancellation). */
    WARNING
}
