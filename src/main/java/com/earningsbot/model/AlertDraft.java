package com.earningsbot.model;

import java.time.LocalDate;

/**
 * Alert content before it is written to the journal.
 */
public record AlertDraft(
        String eventKey,
        AlertType alertType,
        String symbol,
        LocalDate asOf,
        String message
) {
}
