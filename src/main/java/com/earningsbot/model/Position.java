package com.earningsbot.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One tracked position. Exit fields stay null while the position is OPEN and are
 * written together when it is closed.
 */
@Value
@Builder(toBuilder = true)
public class Position {
    UUID id;
    String symbol;
    LocalDate entryDate;
    BigDecimal entryPrice;
    PositionStatus status;
    LocalDate exitDate;
    BigDecimal exitPrice;
    ExitReason exitReason;
    OffsetDateTime createdAt;
    OffsetDateTime updatedAt;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }
}
