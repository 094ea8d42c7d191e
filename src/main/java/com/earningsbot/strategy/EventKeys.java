package com.earningsbot.strategy;

import com.earningsbot.model.ExitReason;

import java.time.LocalDate;

/**
 * Deterministic alert keys. The alerts table has a unique constraint on the key, which is
 * what makes alert inserts idempotent across reruns.
 */
public final class EventKeys {
    private static final String SEPARATOR = "|";

    private EventKeys() {
    }

    public static String entry(String symbol, LocalDate asOf) {
        return "ENTRY" + SEPARATOR + symbol + SEPARATOR + asOf.toString();
    }

    public static String exit(String symbol, LocalDate entryDate, LocalDate exitDate, ExitReason reason) {
        return "EXIT" + SEPARATOR + symbol
                + SEPARATOR + entryDate.toString()
                + SEPARATOR + exitDate.toString()
                + SEPARATOR + reason.name();
    }
}
