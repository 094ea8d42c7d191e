package com.earningsbot.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A notification row. {@code sentAt} is null until delivery is acknowledged.
 */
@Value
@Builder(toBuilder = true)
public class Alert {
    UUID id;
    String eventKey;
    AlertType alertType;
    String symbol;
    LocalDate asOf;
    String message;
    OffsetDateTime createdAt;
    OffsetDateTime sentAt;

    public boolean isSent() {
        return sentAt != null;
    }
}
