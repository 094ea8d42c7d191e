package com.earningsbot.strategy;

import com.earningsbot.model.ExitReason;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class EventKeysTest {
    private static final LocalDate D1 = LocalDate.of(2025, 1, 15);
    private static final LocalDate D2 = LocalDate.of(2025, 3, 6);

    @Test
    void entryKeyShouldUseIsoDate() {
        assertEquals("ENTRY|AAPL|2025-01-15", EventKeys.entry("AAPL", D1));
        assertEquals(EventKeys.entry("AAPL", D1), EventKeys.entry("AAPL", LocalDate.parse("2025-01-15")));
    }

    @Test
    void exitKeyShouldCarryEntryExitAndReason() {
        assertEquals("EXIT|AAPL|2025-01-15|2025-03-06|TIME_EXIT",
                EventKeys.exit("AAPL", D1, D2, ExitReason.TIME_EXIT));
    }

    @Test
    void keysShouldDifferWhenAnyFieldDiffers() {
        String base = EventKeys.exit("AAPL", D1, D2, ExitReason.STOP_LOSS);

        assertNotEquals(base, EventKeys.exit("MSFT", D1, D2, ExitReason.STOP_LOSS));
        assertNotEquals(base, EventKeys.exit("AAPL", D1.plusDays(1), D2, ExitReason.STOP_LOSS));
        assertNotEquals(base, EventKeys.exit("AAPL", D1, D2.plusDays(1), ExitReason.STOP_LOSS));
        assertNotEquals(base, EventKeys.exit("AAPL", D1, D2, ExitReason.TIME_EXIT));
        assertNotEquals(EventKeys.entry("AAPL", D1), EventKeys.entry("AAPL", D2));
    }
}
