package com.earningsbot.strategy;

import com.earningsbot.model.EntrySignal;
import com.earningsbot.model.ExitReason;
import com.earningsbot.model.ExitSignal;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalEvaluatorTest {
    private static final BigDecimal HUNDRED = new BigDecimal("100.00");
    private static final LocalDate ENTRY = LocalDate.of(2025, 1, 1);

    @Test
    void entryShouldFireOnBothInclusiveBoundaries() {
        assertTrue(SignalEvaluator.evaluateEntry(new BigDecimal("70.00"), HUNDRED).isPresent());
        assertTrue(SignalEvaluator.evaluateEntry(new BigDecimal("95.00"), HUNDRED).isPresent());
    }

    @Test
    void entryShouldNotFireJustOutsideTheBand() {
        assertFalse(SignalEvaluator.evaluateEntry(new BigDecimal("69.00"), HUNDRED).isPresent());
        assertFalse(SignalEvaluator.evaluateEntry(new BigDecimal("96.00"), HUNDRED).isPresent());
        assertFalse(SignalEvaluator.evaluateEntry(new BigDecimal("105.00"), HUNDRED).isPresent());
    }

    @Test
    void entryShouldReportTheEarningsDayReturn() {
        Optional<EntrySignal> signal = SignalEvaluator.evaluateEntry(new BigDecimal("88.00"), HUNDRED);

        assertTrue(signal.isPresent());
        assertEquals(0, new BigDecimal("-0.12").compareTo(signal.get().earningsReturn()));
    }

    @Test
    void entryShouldIgnoreZeroOrMissingPreviousClose() {
        assertFalse(SignalEvaluator.evaluateEntry(new BigDecimal("88.00"), BigDecimal.ZERO).isPresent());
        assertFalse(SignalEvaluator.evaluateEntry(new BigDecimal("88.00"), null).isPresent());
        assertFalse(SignalEvaluator.evaluateEntry(null, HUNDRED).isPresent());
    }

    @Test
    void stopLossShouldFireAtMinusTenPercentButNotAtMinusNine() {
        LocalDate asOf = ENTRY.plusDays(10);

        Optional<ExitSignal> atBoundary = SignalEvaluator.evaluateExit(HUNDRED, new BigDecimal("90.00"), ENTRY, asOf);
        Optional<ExitSignal> above = SignalEvaluator.evaluateExit(HUNDRED, new BigDecimal("91.00"), ENTRY, asOf);

        assertEquals(ExitReason.STOP_LOSS, atBoundary.orElseThrow().reason());
        assertFalse(above.isPresent());
    }

    @Test
    void timeExitShouldFireAtFiftyDaysButNotFortyNine() {
        Optional<ExitSignal> atFifty = SignalEvaluator.evaluateExit(HUNDRED, HUNDRED, ENTRY, ENTRY.plusDays(50));
        Optional<ExitSignal> atFortyNine = SignalEvaluator.evaluateExit(HUNDRED, HUNDRED, ENTRY, ENTRY.plusDays(49));

        assertEquals(ExitReason.TIME_EXIT, atFifty.orElseThrow().reason());
        assertEquals(50L, atFifty.get().holdingDays());
        assertFalse(atFortyNine.isPresent());
    }

    @Test
    void stopLossShouldWinWhenBothExitConditionsHold() {
        Optional<ExitSignal> signal = SignalEvaluator.evaluateExit(HUNDRED, new BigDecimal("80.00"), ENTRY, ENTRY.plusDays(60));

        assertEquals(ExitReason.STOP_LOSS, signal.orElseThrow().reason());
    }

    @Test
    void flatPositionHeldFiftyCalendarDaysShouldTimeExit() {
        LocalDate asOf = LocalDate.of(2025, 2, 20);

        ExitSignal signal = SignalEvaluator.evaluateExit(HUNDRED, HUNDRED, ENTRY, asOf).orElseThrow();

        assertEquals(ExitReason.TIME_EXIT, signal.reason());
        assertEquals(50L, signal.holdingDays());
        assertEquals(0, BigDecimal.ZERO.compareTo(signal.pnl()));
    }

    @Test
    void elevenPercentLossAfterTenDaysShouldStopOut() {
        ExitSignal signal = SignalEvaluator.evaluateExit(HUNDRED, new BigDecimal("89.00"), ENTRY, ENTRY.plusDays(10))
                .orElseThrow();

        assertEquals(ExitReason.STOP_LOSS, signal.reason());
        assertEquals(0, new BigDecimal("-0.11").compareTo(signal.pnl()));
        assertEquals(10L, signal.holdingDays());
    }
}
