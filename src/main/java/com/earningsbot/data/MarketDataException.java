package com.earningsbot.data;

/**
 * Failure talking to the market data provider. {@code retryable} marks timeouts, I/O
 * errors and server-side (5xx) responses.
 */
public class MarketDataException extends RuntimeException {
    private final boolean retryable;
    private final int statusCode;

    public MarketDataException(String message, boolean retryable) {
        this(message, retryable, 0, null);
    }

    public MarketDataException(String message, boolean retryable, int statusCode, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.statusCode = statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * HTTP status of the failed response, 0 when the request never got one.
     */
    public int statusCode() {
        return statusCode;
    }
}
