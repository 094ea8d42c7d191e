package com.earningsbot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertInsertParam {
    private String id;
    private String eventKey;
    private String alertType;
    private String symbol;
    private LocalDate asOf;
    private String message;
    private OffsetDateTime createdAt;
}
