package com.earningsbot.model;

import java.math.BigDecimal;

/**
 * Close on the requested trading day and on the trading day right before it.
 */
public record PricePair(BigDecimal close, BigDecimal prevClose) {
}
