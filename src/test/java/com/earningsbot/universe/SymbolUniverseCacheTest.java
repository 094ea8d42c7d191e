package com.earningsbot.universe;

import com.earningsbot.support.FakeMarketDataSource;
import com.earningsbot.support.InMemorySymbolCacheStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SymbolUniverseCacheTest {
    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 1, 15, 21, 0, 0, 0, ZoneOffset.UTC);
    private static final Duration TTL = Duration.ofHours(24);

    @Test
    void freshCacheShouldBeServedWithoutFetching() throws Exception {
        InMemorySymbolCacheStore store = new InMemorySymbolCacheStore();
        store.seed(List.of("MSFT", "AAPL"), NOW.minusHours(23));
        FakeMarketDataSource market = new FakeMarketDataSource().constituents("NVDA");

        Set<String> universe = new SymbolUniverseCache(store, market).getUniverse(NOW, TTL);

        assertEquals(Set.of("AAPL", "MSFT"), universe);
        assertEquals(0, market.constituentCalls);
    }

    @Test
    void staleCacheShouldBeServedWhenRefreshFails() throws Exception {
        InMemorySymbolCacheStore store = new InMemorySymbolCacheStore();
        store.seed(List.of("AAPL", "MSFT"), NOW.minusHours(25));
        FakeMarketDataSource market = new FakeMarketDataSource()
                .failConstituents(FakeMarketDataSource.transientFailure("fmp request timed out"));

        Set<String> universe = new SymbolUniverseCache(store, market).getUniverse(NOW, TTL);

        assertEquals(Set.of("AAPL", "MSFT"), universe);
        assertEquals(1, market.constituentCalls);
        assertEquals(0, store.replaceCalls);
    }

    @Test
    void staleCacheShouldBeServedWhenRefreshIsEmpty() throws Exception {
        InMemorySymbolCacheStore store = new InMemorySymbolCacheStore();
        store.seed(List.of("AAPL"), NOW.minusDays(3));
        FakeMarketDataSource market = new FakeMarketDataSource();

        Set<String> universe = new SymbolUniverseCache(store, market).getUniverse(NOW, TTL);

        assertEquals(Set.of("AAPL"), universe);
    }

    @Test
    void expiredCacheShouldBeReplacedBySuccessfulRefresh() throws Exception {
        InMemorySymbolCacheStore store = new InMemorySymbolCacheStore();
        store.seed(List.of("AAPL", "GONE"), NOW.minusHours(24));
        FakeMarketDataSource market = new FakeMarketDataSource().constituents("AAPL", "NVDA", "AAPL");

        Set<String> universe = new SymbolUniverseCache(store, market).getUniverse(NOW, TTL);

        assertEquals(Set.of("AAPL", "NVDA"), universe);
        assertEquals(1, store.replaceCalls);
        assertEquals(Set.of("AAPL", "NVDA"), store.loadAll().keySet());
        assertEquals(NOW, store.loadAll().get("NVDA"));
    }

    @Test
    void freshnessShouldBeJudgedByTheOldestEntry() throws Exception {
        InMemorySymbolCacheStore store = new InMemorySymbolCacheStore();
        store.seed(List.of("AAPL"), NOW.minusHours(1));
        store.seed(List.of("MSFT"), NOW.minusHours(30));
        FakeMarketDataSource market = new FakeMarketDataSource().constituents("AAPL", "MSFT");

        new SymbolUniverseCache(store, market).getUniverse(NOW, TTL);

        assertEquals(1, market.constituentCalls);
    }

    @Test
    void noCacheAndNoDataShouldGiveEmptyUniverse() throws Exception {
        InMemorySymbolCacheStore store = new InMemorySymbolCacheStore();
        FakeMarketDataSource market = new FakeMarketDataSource();

        assertTrue(new SymbolUniverseCache(store, market).getUniverse(NOW, TTL).isEmpty());
        assertEquals(0, store.replaceCalls);
    }
}
