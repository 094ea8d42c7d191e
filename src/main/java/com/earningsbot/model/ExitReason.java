package com.earningsbot.model;

/**
 * Why an open position was closed.
 */
public enum ExitReason {
    STOP_LOSS,
    TIME_EXIT;

    public static ExitReason fromDb(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        return valueOf(raw.trim().toUpperCase());
    }
}
