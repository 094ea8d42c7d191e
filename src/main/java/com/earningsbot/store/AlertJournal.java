package com.earningsbot.store;

import com.earningsbot.model.Alert;
import com.earningsbot.model.AlertDraft;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Deduplicated alert store keyed by event key.
 */
public interface AlertJournal {

    /**
     * Insert-or-ignore on the event key.
     *
     * @return true when the alert did not exist before
     */
    boolean recordIfAbsent(AlertDraft draft) throws SQLException;

    /**
     * Unsent alerts, oldest first.
     */
    List<Alert> listPending(int limit) throws SQLException;

    Optional<Alert> findById(UUID id) throws SQLException;

    /**
     * Stamps {@code sentAt} once. Returns the stored alert, with the original timestamp when it
     * was already sent, or empty when the id is unknown.
     */
    Optional<Alert> markSent(UUID id, OffsetDateTime now) throws SQLException;
}
