package com.earningsbot.strategy;

import com.earningsbot.model.ExitReason;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Human readable alert text picked up by the external notifier.
 */
public final class AlertMessages {
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private AlertMessages() {
    }

    public static String entry(String symbol, LocalDate asOf, BigDecimal earningsReturn, BigDecimal entryPrice) {
        return "[ENTRY] " + symbol + " " + asOf + "\n"
                + "Earnings day return: " + percent(earningsReturn) + "%\n"
                + "Entry price (close): " + twoPlaces(entryPrice);
    }

    public static String exit(
            String symbol,
            LocalDate exitDate,
            ExitReason reason,
            BigDecimal pnl,
            BigDecimal exitPrice,
            long holdingDays
    ) {
        return "[EXIT-" + reason.name() + "] " + symbol + " " + exitDate + "\n"
                + "PnL: " + percent(pnl) + "%\n"
                + "Exit price (close): " + twoPlaces(exitPrice) + "\n"
                + "Holding days: " + holdingDays;
    }

    static String percent(BigDecimal ratio) {
        return twoPlaces(ratio.multiply(HUNDRED));
    }

    static String twoPlaces(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }
}
