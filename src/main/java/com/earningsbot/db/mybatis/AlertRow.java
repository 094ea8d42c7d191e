package com.earningsbot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertRow {
    private String id;
    private String eventKey;
    private String alertType;
    private String symbol;
    private LocalDate asOf;
    private String message;
    private OffsetDateTime createdAt;
    private OffsetDateTime sentAt;
}
