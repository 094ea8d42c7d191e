package com.earningsbot.db;

import com.earningsbot.db.mybatis.PositionCloseParam;
import com.earningsbot.db.mybatis.PositionInsertParam;
import com.earningsbot.db.mybatis.PositionMapper;
import com.earningsbot.db.mybatis.PositionRow;
import com.earningsbot.model.ExitReason;
import com.earningsbot.model.Position;
import com.earningsbot.model.PositionStatus;
import com.earningsbot.store.PositionLedger;
import org.apache.ibatis.session.SqlSession;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Position ledger bound to one session. Commit is owned by {@link PgSignalStore}.
 */
final class PositionDao implements PositionLedger {
    private final PositionMapper mapper;
    private final Clock clock;

    PositionDao(SqlSession session, Clock clock) {
        this.mapper = session.getMapper(PositionMapper.class);
        this.clock = clock;
    }

    @Override
    public boolean openIfAbsent(String symbol, LocalDate entryDate, BigDecimal entryPrice) {
        PositionInsertParam row = PositionInsertParam.builder()
                .id(UUID.randomUUID().toString())
                .symbol(symbol)
                .entryDate(entryDate)
                .entryPrice(entryPrice)
                .createdAt(OffsetDateTime.now(clock))
                .build();
        return mapper.insertIfAbsent(row) > 0;
    }

    @Override
    public List<Position> listOpen() {
        List<Position> out = new ArrayList<>();
        for (PositionRow row : mapper.selectOpen()) {
            out.add(toPosition(row));
        }
        return out;
    }

    @Override
    public boolean close(UUID id, LocalDate exitDate, BigDecimal exitPrice, ExitReason reason) {
        PositionCloseParam row = PositionCloseParam.builder()
                .id(id.toString())
                .exitDate(exitDate)
                .exitPrice(exitPrice)
                .exitReason(reason.name())
                .updatedAt(OffsetDateTime.now(clock))
                .build();
        return mapper.closeIfOpen(row) > 0;
    }

    static Position toPosition(PositionRow row) {
        return Position.builder()
                .id(UUID.fromString(row.getId()))
                .symbol(row.getSymbol())
                .entryDate(row.getEntryDate())
                .entryPrice(row.getEntryPrice())
                .status(PositionStatus.fromDb(row.getStatus()))
                .exitDate(row.getExitDate())
                .exitPrice(row.getExitPrice())
                .exitReason(ExitReason.fromDb(row.getExitReason()))
                .createdAt(row.getCreatedAt())
                .updatedAt(row.getUpdatedAt())
                .build();
    }
}
