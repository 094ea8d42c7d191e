package com.earningsbot.db;

import com.earningsbot.db.mybatis.AlertInsertParam;
import com.earningsbot.db.mybatis.AlertMapper;
import com.earningsbot.db.mybatis.AlertRow;
import com.earningsbot.model.Alert;
import com.earningsbot.model.AlertDraft;
import com.earningsbot.model.AlertType;
import com.earningsbot.store.AlertJournal;
import org.apache.ibatis.session.SqlSession;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

final class AlertDao implements AlertJournal {
    private final AlertMapper mapper;
    private final Clock clock;

    AlertDao(SqlSession session, Clock clock) {
        this.mapper = session.getMapper(AlertMapper.class);
        this.clock = clock;
    }

    @Override
    public boolean recordIfAbsent(AlertDraft draft) {
        AlertInsertParam row = AlertInsertParam.builder()
                .id(UUID.randomUUID().toString())
                .eventKey(draft.eventKey())
                .alertType(draft.alertType().name())
                .symbol(draft.symbol())
                .asOf(draft.asOf())
                .message(draft.message())
                .createdAt(OffsetDateTime.now(clock))
                .build();
        return mapper.insertIfAbsent(row) > 0;
    }

    @Override
    public List<Alert> listPending(int limit) {
        List<Alert> out = new ArrayList<>();
        for (AlertRow row : mapper.selectPending(limit)) {
            out.add(toAlert(row));
        }
        return out;
    }

    @Override
    public Optional<Alert> findById(UUID id) {
        return Optional.ofNullable(mapper.selectById(id.toString())).map(AlertDao::toAlert);
    }

    @Override
    public Optional<Alert> markSent(UUID id, OffsetDateTime now) {
        // A second call finds sent_at already set and only re-reads the row.
        mapper.markSentIfUnsent(id.toString(), now);
        return findById(id);
    }

    static Alert toAlert(AlertRow row) {
        return Alert.builder()
                .id(UUID.fromString(row.getId()))
                .eventKey(row.getEventKey())
                .alertType(AlertType.valueOf(row.getAlertType().trim().toUpperCase(Locale.ROOT)))
                .symbol(row.getSymbol())
                .asOf(row.getAsOf())
                .message(row.getMessage())
                .createdAt(row.getCreatedAt())
                .sentAt(row.getSentAt())
                .build();
    }
}
