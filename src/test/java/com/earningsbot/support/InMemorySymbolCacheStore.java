package com.earningsbot.support;

import com.earningsbot.universe.SymbolCacheStore;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class InMemorySymbolCacheStore implements SymbolCacheStore {
    private final Map<String, OffsetDateTime> rows = new LinkedHashMap<>();
    public int replaceCalls;

    public void seed(List<String> symbols, OffsetDateTime updatedAt) {
        for (String symbol : symbols) {
            rows.put(symbol, updatedAt);
        }
    }

    @Override
    public Map<String, OffsetDateTime> loadAll() {
        return new LinkedHashMap<>(rows);
    }

    @Override
    public void replaceAll(List<String> symbols, OffsetDateTime updatedAt) {
        replaceCalls++;
        rows.clear();
        seed(symbols, updatedAt);
    }
}
