package com.earningsbot.alerts;

import com.earningsbot.model.Alert;
import com.earningsbot.model.Position;
import com.earningsbot.store.SignalStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Read and acknowledge side of the alert journal, used by the external notifier.
 */
public final class AlertService {
    private static final Logger LOG = LogManager.getLogger(AlertService.class);

    public static final int DEFAULT_LIMIT = 200;
    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 500;

    private final SignalStore store;
    private final Clock clock;

    public AlertService(SignalStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public List<Alert> listPendingAlerts(int limit) throws SQLException {
        if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between " + MIN_LIMIT + " and " + MAX_LIMIT + ": " + limit);
        }
        return store.inTransaction((positions, alerts) -> alerts.listPending(limit));
    }

    /**
     * Acknowledges delivery. Calling it again for an acknowledged alert returns the stored
     * timestamp unchanged.
     *
     * @throws AlertNotFoundException when no alert has this id
     */
    public Alert markAlertSent(UUID id) throws SQLException {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Alert alert = store.inTransaction((positions, alerts) -> alerts.markSent(id, now))
                .orElseThrow(() -> new AlertNotFoundException(id));
        LOG.info("Alert marked sent: id={} sent_at={}", alert.getId(), alert.getSentAt());
        return alert;
    }

    public List<Position> listOpenPositions() throws SQLException {
        return store.inTransaction((positions, alerts) -> positions.listOpen());
    }
}
