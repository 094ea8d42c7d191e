package com.earningsbot.model;

import java.math.BigDecimal;

public record EntrySignal(BigDecimal earningsReturn) {
}
