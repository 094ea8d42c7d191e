package com.earningsbot.data;

import com.earningsbot.model.DailyClose;
import com.earningsbot.model.PricePair;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Logical contract of the external market data provider.
 * Implementations throw {@link MarketDataException} (or {@link RateLimitException}) once
 * their own retry policy is exhausted.
 */
public interface MarketDataSource {
    int DEFAULT_LOOKBACK_BARS = 20;

    List<String> listIndexConstituents();

    /**
     * Symbols reporting earnings on exactly this calendar date.
     */
    List<String> earningsOn(LocalDate date);

    /**
     * Most recent {@code count} daily closes, newest first.
     */
    List<DailyClose> historicalCloses(String symbol, int count);

    default int lookbackBars() {
        return DEFAULT_LOOKBACK_BARS;
    }

    default Optional<PricePair> priceAndPrevClose(String symbol, LocalDate date) {
        return PriceWindow.closeAndPrevClose(historicalCloses(symbol, lookbackBars()), date);
    }

    default Optional<BigDecimal> closeOn(String symbol, LocalDate date) {
        return PriceWindow.closeOn(historicalCloses(symbol, lookbackBars()), date);
    }
}
