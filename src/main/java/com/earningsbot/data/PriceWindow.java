package com.earningsbot.data;

import com.earningsbot.model.DailyClose;
import com.earningsbot.model.PricePair;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Exact-date lookups in a newest-first lookback window of daily closes.
 * A date missing from the window (holiday, stale feed, gap longer than the window) is
 * reported as absent; nothing is interpolated.
 */
public final class PriceWindow {
    private PriceWindow() {
    }

    public static Optional<PricePair> closeAndPrevClose(List<DailyClose> newestFirst, LocalDate date) {
        int idx = indexOf(newestFirst, date);
        if (idx < 0 || idx + 1 >= newestFirst.size()) {
            return Optional.empty();
        }
        BigDecimal close = newestFirst.get(idx).close;
        BigDecimal prevClose = newestFirst.get(idx + 1).close;
        if (close == null || prevClose == null) {
            return Optional.empty();
        }
        return Optional.of(new PricePair(close, prevClose));
    }

    public static Optional<BigDecimal> closeOn(List<DailyClose> newestFirst, LocalDate date) {
        int idx = indexOf(newestFirst, date);
        if (idx < 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(newestFirst.get(idx).close);
    }

    private static int indexOf(List<DailyClose> newestFirst, LocalDate date) {
        if (newestFirst == null || date == null) {
            return -1;
        }
        for (int i = 0; i < newestFirst.size(); i++) {
            DailyClose bar = newestFirst.get(i);
            if (bar != null && date.equals(bar.tradeDate)) {
                return i;
            }
        }
        return -1;
    }
}
