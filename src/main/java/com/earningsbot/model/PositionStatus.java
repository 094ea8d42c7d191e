package com.earningsbot.model;

public enum PositionStatus {
    OPEN,
    CLOSED;

    public static PositionStatus fromDb(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return OPEN;
        }
        return valueOf(raw.trim().toUpperCase());
    }
}
