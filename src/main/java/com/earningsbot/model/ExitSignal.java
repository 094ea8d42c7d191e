package com.earningsbot.model;

import java.math.BigDecimal;

public record ExitSignal(ExitReason reason, BigDecimal pnl, long holdingDays) {
}
