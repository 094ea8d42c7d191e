package com.earningsbot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SymbolCacheRow {
    private String symbol;
    private OffsetDateTime updatedAt;
}
