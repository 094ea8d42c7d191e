package com.earningsbot.strategy;

import com.earningsbot.model.EntrySignal;
import com.earningsbot.model.ExitReason;
import com.earningsbot.model.ExitSignal;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Entry/exit rule for earnings-day drops. Pure decimal arithmetic, no I/O.
 * All thresholds are inclusive.
 */
public final class SignalEvaluator {
    public static final BigDecimal ENTRY_RETURN_MIN = new BigDecimal("-0.30");
    public static final BigDecimal ENTRY_RETURN_MAX = new BigDecimal("-0.05");
    public static final BigDecimal STOP_LOSS_THRESHOLD = new BigDecimal("-0.10");
    public static final int MAX_HOLDING_DAYS = 50;

    private static final MathContext RATIO_CONTEXT = MathContext.DECIMAL128;

    private SignalEvaluator() {
    }

    /**
     * Fires when the close-to-close return on the earnings day lies in [-30%, -5%].
     */
    public static Optional<EntrySignal> evaluateEntry(BigDecimal asOfClose, BigDecimal prevClose) {
        if (asOfClose == null || prevClose == null || prevClose.signum() == 0) {
            return Optional.empty();
        }
        BigDecimal earningsReturn = relativeChange(asOfClose, prevClose);
        if (earningsReturn.compareTo(ENTRY_RETURN_MIN) >= 0 && earningsReturn.compareTo(ENTRY_RETURN_MAX) <= 0) {
            return Optional.of(new EntrySignal(earningsReturn));
        }
        return Optional.empty();
    }

    /**
     * Stop-loss is checked before the time exit, so at most one reason is reported.
     */
    public static Optional<ExitSignal> evaluateExit(
            BigDecimal entryPrice,
            BigDecimal currentClose,
            LocalDate entryDate,
            LocalDate asOfDate
    ) {
        if (entryPrice == null || currentClose == null || entryDate == null || asOfDate == null
                || entryPrice.signum() == 0) {
            return Optional.empty();
        }
        BigDecimal pnl = relativeChange(currentClose, entryPrice);
        long holdingDays = holdingDays(entryDate, asOfDate);
        if (pnl.compareTo(STOP_LOSS_THRESHOLD) <= 0) {
            return Optional.of(new ExitSignal(ExitReason.STOP_LOSS, pnl, holdingDays));
        }
        if (holdingDays >= MAX_HOLDING_DAYS) {
            return Optional.of(new ExitSignal(ExitReason.TIME_EXIT, pnl, holdingDays));
        }
        return Optional.empty();
    }

    public static long holdingDays(LocalDate entryDate, LocalDate asOfDate) {
        return ChronoUnit.DAYS.between(entryDate, asOfDate);
    }

    static BigDecimal relativeChange(BigDecimal current, BigDecimal base) {
        return current.divide(base, RATIO_CONTEXT).subtract(BigDecimal.ONE);
    }
}
