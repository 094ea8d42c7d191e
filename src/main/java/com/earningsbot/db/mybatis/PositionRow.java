package com.earningsbot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PositionRow {
    private String id;
    private String symbol;
    private LocalDate entryDate;
    private BigDecimal entryPrice;
    private String status;
    private LocalDate exitDate;
    private BigDecimal exitPrice;
    private String exitReason;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
