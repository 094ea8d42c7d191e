package com.earningsbot.universe;

import com.earningsbot.data.MarketDataException;
import com.earningsbot.data.MarketDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Time-boxed cache of index constituents. Freshness is judged by the oldest cached entry;
 * when a refresh yields nothing the previous snapshot is served, however old.
 */
public final class SymbolUniverseCache {
    private static final Logger LOG = LogManager.getLogger(SymbolUniverseCache.class);

    private final SymbolCacheStore store;
    private final MarketDataSource marketData;

    public SymbolUniverseCache(SymbolCacheStore store, MarketDataSource marketData) {
        this.store = store;
        this.marketData = marketData;
    }

    public Set<String> getUniverse(OffsetDateTime now, Duration ttl) throws SQLException {
        Map<String, OffsetDateTime> cached = store.loadAll();
        if (!cached.isEmpty()) {
            OffsetDateTime oldest = Collections.min(cached.values());
            Duration age = Duration.between(oldest, now);
            if (age.compareTo(ttl) < 0) {
                LOG.info("Using cached index symbols ({} symbols, age={}m)", cached.size(), age.toMinutes());
                return new TreeSet<>(cached.keySet());
            }
        }

        LOG.info("Fetching fresh index constituents");
        List<String> fresh = fetchQuietly();
        if (fresh.isEmpty()) {
            if (!cached.isEmpty()) {
                LOG.warn("Index constituent fetch returned nothing, using stale cache ({} symbols)", cached.size());
                return new TreeSet<>(cached.keySet());
            }
            LOG.warn("Index constituent fetch returned nothing and no cache exists");
            return Set.of();
        }

        Set<String> unique = new LinkedHashSet<>(fresh);
        store.replaceAll(List.copyOf(unique), now);
        LOG.info("Cached {} index symbols", unique.size());
        return unique;
    }

    private List<String> fetchQuietly() {
        try {
            List<String> symbols = marketData.listIndexConstituents();
            return symbols == null ? List.of() : symbols;
        } catch (MarketDataException e) {
            LOG.warn("Index constituent fetch failed: {}", e.getMessage());
            return List.of();
        }
    }
}
