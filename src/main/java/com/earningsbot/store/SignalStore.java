package com.earningsbot.store;

import java.sql.SQLException;

/**
 * Transaction boundary over the ledger and the journal. Every unit of work commits on its own,
 * so a crash leaves earlier units intact and a rerun of the same date replays the rest.
 */
public interface SignalStore {

    <T> T inTransaction(Work<T> work) throws SQLException;

    @FunctionalInterface
    interface Work<T> {
        T apply(PositionLedger positions, AlertJournal alerts) throws SQLException;
    }
}
