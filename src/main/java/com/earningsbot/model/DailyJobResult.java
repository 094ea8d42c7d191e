package com.earningsbot.model;

import java.time.LocalDate;

public record DailyJobResult(LocalDate asOf, int newEntryAlerts, int newExitAlerts) {
}
