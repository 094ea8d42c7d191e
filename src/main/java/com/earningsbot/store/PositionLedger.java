package com.earningsbot.store;

import com.earningsbot.model.ExitReason;
import com.earningsbot.model.Position;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Durable record of positions. Uniqueness of (symbol, entry date) is a storage constraint.
 */
public interface PositionLedger {

    /**
     * Inserts an OPEN position unless one already exists for (symbol, date).
     *
     * @return true when a new row was created
     */
    boolean openIfAbsent(String symbol, LocalDate entryDate, BigDecimal entryPrice) throws SQLException;

    List<Position> listOpen() throws SQLException;

    /**
     * Moves an OPEN position to CLOSED, writing exit date, price and reason together.
     * A position that is already CLOSED is left untouched.
     *
     * @return true when the row was transitioned by this call
     */
    boolean close(UUID id, LocalDate exitDate, BigDecimal exitPrice, ExitReason reason) throws SQLException;
}
