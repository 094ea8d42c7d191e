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
public class PositionCloseParam {
    private String id;
    private LocalDate exitDate;
    private BigDecimal exitPrice;
    private String exitReason;
    private OffsetDateTime updatedAt;
}
