package com.earningsbot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionInsertParam {
    private String id;
    private String symbol;
    private LocalDate entryDate;
    private BigDecimal entryPrice;
    private OffsetDateTime createdAt;
}
