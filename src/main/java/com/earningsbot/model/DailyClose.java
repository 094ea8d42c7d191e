package com.earningsbot.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public final class DailyClose {
    public final LocalDate tradeDate;
    public final BigDecimal close;

    public DailyClose(LocalDate tradeDate, BigDecimal close) {
        this.tradeDate = tradeDate;
        this.close = close;
    }

    @Override
    public String toString() {
        return tradeDate + "=" + close;
    }
}
