package com.earningsbot.data;

/**
 * Provider answered HTTP 429. Not retried by the client; callers decide how to back off.
 */
public class RateLimitException extends MarketDataException {
    public RateLimitException(String message) {
        super(message, false, 429, null);
    }
}
