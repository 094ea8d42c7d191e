package com.earningsbot.universe;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Persistent snapshot of the index universe.
 */
public interface SymbolCacheStore {

    /**
     * All cached symbols with their refresh timestamp.
     */
    Map<String, OffsetDateTime> loadAll() throws SQLException;

    /**
     * Replaces the whole snapshot atomically: the previous content is never mixed with the new one.
     */
    void replaceAll(List<String> symbols, OffsetDateTime updatedAt) throws SQLException;
}
