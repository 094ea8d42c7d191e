package com.earningsbot.core;

/**
 * Result of processing one symbol or one position within a scan phase.
 */
public enum OutcomeStatus {
    NEW_ALERT("new_alert"),
    DUPLICATE("duplicate"),
    NO_SIGNAL("no_signal"),
    NO_DATA("no_data"),
    RATE_LIMITED("rate_limited"),
    ERROR("error");

    private final String label;

    OutcomeStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isFailure() {
        return this == RATE_LIMITED || this == ERROR;
    }
}
